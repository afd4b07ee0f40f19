package com.handelsregister.scraper.service.portal;

import org.springframework.http.HttpMethod;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.net.URI;

/**
 * Everything a transport needs to submit a filled-in form.
 *
 * @param action absolute target URL
 * @param method GET or POST, as declared by the form
 * @param fields successful controls in document order
 */
public record FormSubmission(URI action, HttpMethod method, MultiValueMap<String, String> fields) {

    public FormSubmission {
        fields = new LinkedMultiValueMap<>(fields);
    }
}
