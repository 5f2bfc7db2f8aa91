package com.inboxsync.ingestion.sink;

import com.inboxsync.ingestion.auth.AccessTokenProvider;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Sheets REST client using WebClient. Used by SheetsSinkAdapter.
 */
public class WebClientSheetsClient implements SheetsClient {

    private final WebClient webClient;
    private final AccessTokenProvider tokenProvider;

    public WebClientSheetsClient(WebClient.Builder builder, String baseUrl, AccessTokenProvider tokenProvider) {
        this.webClient = builder.baseUrl(baseUrl).build();
        this.tokenProvider = tokenProvider;
    }

    @Override
    public Mono<String> getSheetTitles(String spreadsheetId) {
        return webClient.get()
                .uri("/spreadsheets/{id}?fields={fields}", spreadsheetId, "sheets.properties.title")
                .headers(h -> h.setBearerAuth(tokenProvider.accessToken()))
                .retrieve()
                .bodyToMono(String.class);
    }

    @Override
    public Mono<String> getValues(String spreadsheetId, String range) {
        return webClient.get()
                .uri("/spreadsheets/{id}/values/{range}", spreadsheetId, range)
                .headers(h -> h.setBearerAuth(tokenProvider.accessToken()))
                .retrieve()
                .bodyToMono(String.class);
    }

    @Override
    public Mono<String> appendValues(String spreadsheetId, String range, List<List<String>> values) {
        return webClient.post()
                .uri("/spreadsheets/{id}/values/{range}:append?valueInputOption=RAW&insertDataOption=INSERT_ROWS",
                        spreadsheetId, range)
                .headers(h -> h.setBearerAuth(tokenProvider.accessToken()))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("values", values))
                .retrieve()
                .bodyToMono(String.class);
    }

    @Override
    public Mono<String> updateValues(String spreadsheetId, String range, List<List<String>> values) {
        return webClient.put()
                .uri("/spreadsheets/{id}/values/{range}?valueInputOption=RAW", spreadsheetId, range)
                .headers(h -> h.setBearerAuth(tokenProvider.accessToken()))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("values", values))
                .retrieve()
                .bodyToMono(String.class);
    }

    @Override
    public Mono<String> batchUpdate(String spreadsheetId, List<Map<String, Object>> requests) {
        return webClient.post()
                .uri("/spreadsheets/{id}:batchUpdate", spreadsheetId)
                .headers(h -> h.setBearerAuth(tokenProvider.accessToken()))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("requests", requests))
                .retrieve()
                .bodyToMono(String.class);
    }
}
