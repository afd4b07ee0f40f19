package com.handelsregister.scraper.service.portal;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Connection;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.FormElement;
import org.springframework.http.HttpMethod;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.net.URI;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Editable snapshot of an HTML form.
 *
 * <p>Holds the values a browser would send right now (checked boxes, selected
 * options, hidden JSF state) and remembers every named control, including
 * unchecked ones, so that setters can tell "not present" apart from "not set".
 * Radio groups and selects also remember which values they offer.</p>
 *
 * <p>Submit controls ({@code <input type="submit">}, {@code <button>}) are kept
 * out of {@link #getFields()}. A submission carries exactly one of them, the
 * one {@link #click(String) clicked} or else the first in document order, the
 * way a browser does when the form is submitted.</p>
 */
@Getter
public final class PortalForm {

    private final String name;

    private final URI action;

    private final HttpMethod method;

    private final Set<String> controls;

    private final Map<String, Set<String>> choices;

    private final MultiValueMap<String, String> fields;

    /** Submit control name to the value it sends, in document order. */
    private final Map<String, String> submitControls;

    private String clicked;

    private PortalForm(final String name, final URI action, final HttpMethod method,
                       final Set<String> controls, final Map<String, Set<String>> choices,
                       final MultiValueMap<String, String> fields, final Map<String, String> submitControls) {
        this.name = name;
        this.action = action;
        this.method = method;
        this.controls = controls;
        this.choices = choices;
        this.fields = fields;
        this.submitControls = submitControls;
    }

    /**
     * Locate a form by its {@code name} or {@code id} attribute.
     */
    public static Optional<PortalForm> find(final PortalPage page, final String formName) {
        return page.document().select("form").forms().stream()
                .filter(f -> formName.equals(f.attr("name")) || formName.equals(f.id()))
                .findFirst()
                .map(f -> from(f, formName, page.getUrl()));
    }

    private static PortalForm from(final FormElement form, final String name, final URI pageUrl) {
        String actionAttr = form.absUrl("action");
        URI action = StringUtils.isBlank(actionAttr) ? pageUrl : URI.create(actionAttr);
        HttpMethod method = "post".equalsIgnoreCase(form.attr("method")) ? HttpMethod.POST : HttpMethod.GET;

        Set<String> controls = new LinkedHashSet<>();
        Map<String, Set<String>> choices = new HashMap<>();
        Map<String, String> submitControls = new LinkedHashMap<>();
        for (Element el : form.elements()) {
            String control = el.attr("name");
            if (control.isEmpty()) {
                continue;
            }
            controls.add(control);
            String type = el.attr("type").toLowerCase(Locale.ROOT);
            if (isSubmitControl(el, type)) {
                if (el.hasAttr("disabled")) {
                    continue;
                }
                submitControls.putIfAbsent(control, el.attr("value"));
            } else if ("radio".equals(type)) {
                choices.computeIfAbsent(control, k -> new LinkedHashSet<>())
                        .add(el.hasAttr("value") ? el.attr("value") : "on");
            } else if ("select".equals(el.normalName())) {
                Set<String> options = choices.computeIfAbsent(control, k -> new LinkedHashSet<>());
                el.select("option").forEach(o -> options.add(o.hasAttr("value") ? o.attr("value") : o.text()));
            }
        }

        MultiValueMap<String, String> fields = new LinkedMultiValueMap<>();
        for (Connection.KeyVal kv : form.formData()) {
            // jsoup includes every <input type="submit">; only the clicked one is sent
            if (!submitControls.containsKey(kv.key())) {
                fields.add(kv.key(), kv.value());
            }
        }
        return new PortalForm(name, action, method, controls, choices, fields, submitControls);
    }

    private static boolean isSubmitControl(final Element el, final String type) {
        if ("button".equals(el.normalName())) {
            return type.isEmpty() || "submit".equals(type);
        }
        return "input".equals(el.normalName()) && "submit".equals(type);
    }

    public boolean hasControl(final String control) {
        return controls.contains(control);
    }

    /**
     * Set a text, hidden, radio or select control to a single value.
     */
    public FieldOutcome set(final String control, final String value) {
        if (!hasControl(control)) {
            return FieldOutcome.missing(control);
        }
        Set<String> offered = choices.get(control);
        if (offered != null && !offered.isEmpty() && !offered.contains(value)) {
            return FieldOutcome.rejected(control, value);
        }
        fields.set(control, value);
        return FieldOutcome.applied(control);
    }

    /**
     * Tick a checkbox.
     */
    public FieldOutcome check(final String control) {
        return set(control, "on");
    }

    /**
     * Add a hidden control the page would normally create through JavaScript.
     */
    public void addHidden(final String control, final String value) {
        controls.add(control);
        fields.set(control, value);
    }

    /**
     * Choose the submit control the submission will carry.
     */
    public FieldOutcome click(final String control) {
        if (!submitControls.containsKey(control)) {
            return FieldOutcome.missing(control);
        }
        clicked = control;
        return FieldOutcome.applied(control);
    }

    public FormSubmission toSubmission() {
        MultiValueMap<String, String> data = new LinkedMultiValueMap<>(fields);
        String button = clicked != null
                ? clicked
                : submitControls.keySet().stream().findFirst().orElse(null);
        if (button != null) {
            data.add(button, submitControls.get(button));
        }
        return new FormSubmission(action, method, data);
    }
}
