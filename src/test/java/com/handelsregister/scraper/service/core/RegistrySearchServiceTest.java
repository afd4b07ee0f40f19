package com.handelsregister.scraper.service.core;

import com.handelsregister.scraper.cache.ResultCache;
import com.handelsregister.scraper.exception.PortalConnectException;
import com.handelsregister.scraper.model.Company;
import com.handelsregister.scraper.model.MatchMode;
import com.handelsregister.scraper.model.SearchQuery;
import com.handelsregister.scraper.parser.RegisterResultGridParser;
import com.handelsregister.scraper.parser.ResultGridParser;
import com.handelsregister.scraper.service.portal.PortalSearchResult;
import com.handelsregister.scraper.service.portal.RegistryPortalSession;
import com.handelsregister.scraper.service.portal.RegistryPortalSessionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegistrySearchServiceTest {

    private static final String ONE_HIT = """
            <table role="grid"><tbody>
              <tr data-ri="0"><td></td><td>Berlin HRB 1</td><td>GASAG AG</td><td>Berlin</td>
              <td>currently registered</td><td>AD</td></tr>
            </tbody></table>
            """;

    private static final String NO_HITS = "<html><body>Keine Ergebnisse</body></html>";

    @Mock
    private RegistryPortalSessionFactory sessions;

    @Mock
    private RegistryPortalSession session;

    @Mock
    private ResultCache cache;

    private final ResultGridParser parser = new RegisterResultGridParser();

    private RegistrySearchService service;

    @BeforeEach
    void setUp() {
        service = new RegistrySearchService(sessions, cache, parser);
    }

    @Test
    void cacheHitSkipsPortal() {
        when(cache.get("Gasag AG")).thenReturn(Optional.of(ONE_HIT));

        List<Company> companies = service.search(SearchQuery.of("Gasag AG", MatchMode.ALL));

        assertThat(companies).extracting(Company::registerNumber).containsExactly("HRB 1 B");
        verifyNoInteractions(sessions);
        verify(cache, never()).put(anyString(), anyString());
    }

    @Test
    void missFetchesCachesAndParses() {
        when(cache.get("Gasag AG")).thenReturn(Optional.empty());
        when(sessions.newSession()).thenReturn(session);
        when(session.submitSearch(any())).thenReturn(new PortalSearchResult(ONE_HIT, List.of()));

        List<Company> companies = service.search(SearchQuery.of("Gasag AG", MatchMode.ALL));

        assertThat(companies).hasSize(1);
        verify(session).open();
        verify(cache).put("Gasag AG", ONE_HIT);
    }

    @Test
    void bypassIgnoresAndOverwritesCache() {
        when(sessions.newSession()).thenReturn(session);
        when(session.submitSearch(any())).thenReturn(new PortalSearchResult(NO_HITS, List.of("warning")));

        SearchQuery query = new SearchQuery("Gasag AG", MatchMode.EXACT, Set.of(), true, false);
        List<Company> companies = service.search(query);

        assertThat(companies).isEmpty();
        verify(cache, never()).get(anyString());
        verify(cache).put("Gasag AG", NO_HITS);
    }

    @Test
    void cachedAndFreshResultsAreEqual() {
        when(cache.get("Gasag AG")).thenReturn(Optional.empty(), Optional.of(ONE_HIT));
        when(sessions.newSession()).thenReturn(session);
        when(session.submitSearch(any())).thenReturn(new PortalSearchResult(ONE_HIT, List.of()));

        List<Company> fresh = service.search(SearchQuery.of("Gasag AG", MatchMode.ALL));
        List<Company> cached = service.search(SearchQuery.of("Gasag AG", MatchMode.ALL));

        assertThat(cached).isEqualTo(fresh);
    }

    @Test
    void sessionFailurePropagatesAndCachesNothing() {
        when(cache.get("Bank")).thenReturn(Optional.empty());
        when(sessions.newSession()).thenReturn(session);
        doThrow(new PortalConnectException("Cannot open register portal", null)).when(session).open();

        assertThatThrownBy(() -> service.search(SearchQuery.of("Bank", MatchMode.ANY)))
                .isInstanceOf(PortalConnectException.class);
        verify(cache, never()).put(anyString(), anyString());
    }
}
