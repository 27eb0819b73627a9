package com.example.finsight.service;

import com.example.finsight.http.SecEdgarClient;
import com.example.finsight.model.EntityRef;
import com.example.finsight.model.doc.EntityDoc;
import com.example.finsight.repo.EntityRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EntityResolverTest {

    @Mock
    private EntityRepository entityRepo;
    @Mock
    private SecEdgarClient sec;

    private static Map<String, Object> tickerTable() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("0", Map.of("cik_str", 320193, "ticker", "AAPL", "title", "Apple Inc."));
        body.put("1", Map.of("cik_str", 1067983, "ticker", "BRK-B", "title", "BERKSHIRE HATHAWAY INC"));
        return body;
    }

    @Test
    @DisplayName("SEC 티커 표에서 10자리 CIK 를 찾는다")
    void resolvesFromSecTable() {
        when(sec.getCompanyTickers()).thenReturn(Mono.just(tickerTable()));
        when(entityRepo.findByTicker(anyString())).thenReturn(Mono.empty());
        EntityResolver resolver = new EntityResolver(entityRepo, sec);

        StepVerifier.create(resolver.resolve(" aapl "))
                .assertNext(e -> {
                    assertEquals("0000320193", e.getCik());
                    assertEquals("0000320193", e.getId());
                    assertEquals("AAPL", e.getTicker());
                })
                .verifyComplete();
        StepVerifier.create(resolver.resolve("BRK.B"))
                .assertNext(e -> assertEquals("0001067983", e.getCik()))
                .verifyComplete();
        StepVerifier.create(resolver.resolve("ZZZZ"))
                .assertNext(e -> {
                    assertFalse(e.hasCik());
                    assertEquals("ZZZZ", e.getId());
                })
                .verifyComplete();
        verify(sec, times(1)).getCompanyTickers();
    }

    @Test
    @DisplayName("로컬 등록 정보가 SEC 표보다 우선")
    void localRegistryWins() {
        when(sec.getCompanyTickers()).thenReturn(Mono.just(tickerTable()));
        EntityDoc doc = new EntityDoc();
        doc.setId("0000000001");
        doc.setTicker("AAPL");
        doc.setCik("0000000001");
        when(entityRepo.findByTicker("AAPL")).thenReturn(Mono.just(doc));
        EntityResolver resolver = new EntityResolver(entityRepo, sec);

        StepVerifier.create(resolver.resolve("AAPL"))
                .assertNext(e -> assertEquals("0000000001", e.getCik()))
                .verifyComplete();
    }

    @Test
    @DisplayName("SEC 표 조회 실패 시 티커만으로 계속")
    void secFailureFallsBackToTicker() {
        when(sec.getCompanyTickers()).thenReturn(Mono.error(new IllegalStateException("boom")));
        when(entityRepo.findByTicker("MSFT")).thenReturn(Mono.empty());
        EntityResolver resolver = new EntityResolver(entityRepo, sec);

        StepVerifier.create(resolver.resolve("MSFT"))
                .expectNext(EntityRef.ofTicker("MSFT"))
                .verifyComplete();
    }

    @Test
    void rejectsInvalidTicker() {
        assertThrows(IllegalArgumentException.class, () -> EntityResolver.normalize(" "));
        assertThrows(IllegalArgumentException.class, () -> EntityResolver.normalize("AAPL;DROP"));
        assertEquals("BRK.B", EntityResolver.normalize("brk.b"));
    }
}
