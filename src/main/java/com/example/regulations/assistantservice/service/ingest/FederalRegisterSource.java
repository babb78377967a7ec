// src/main/java/com/example/regulations/assistantservice/service/ingest/FederalRegisterSource.java
package com.example.regulations.assistantservice.service.ingest;

import com.example.regulations.assistantservice.config.RagProperties;
import com.example.regulations.assistantservice.webdto.SourcePageDto;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.LocalDate;
import java.util.List;

@Component
public class FederalRegisterSource implements DocumentSource {

    static final List<String> FIELDS = List.of(
            "document_number", "title", "abstract", "publication_date", "agencies", "type",
            "html_url", "raw_text_url");

    private final RestTemplate rt;
    private final RagProperties.Source cfg;

    public FederalRegisterSource(RestTemplateBuilder restTemplateBuilder, RagProperties properties) {
        this.cfg = properties.getSource();
        this.rt = restTemplateBuilder
                .setConnectTimeout(cfg.getConnectTimeout())
                .setReadTimeout(cfg.getReadTimeout())
                .build();
    }

    @Override
    public SourcePageDto fetchPage(LocalDate start, LocalDate end, int page) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(cfg.getBaseUrl())
                .queryParam("per_page", cfg.getPageSize())
                .queryParam("page", page)
                .queryParam("order", "oldest")
                .queryParam(cfg.getSinceParam(), start.toString());
        if (end != null) {
            uri.queryParam(cfg.getUntilParam(), end.toString());
        }
        FIELDS.forEach(f -> uri.queryParam("fields[]", f));
        URI target = uri.encode().build().toUri();

        ResponseEntity<SourcePageDto> resp = rt.exchange(
                target, HttpMethod.GET, new HttpEntity<>(jsonHeaders()), SourcePageDto.class);
        if (!resp.getStatusCode().is2xxSuccessful() || resp.getBody() == null) {
            throw new RestClientException("Failed to fetch page " + page + ": status=" + resp.getStatusCode());
        }
        return resp.getBody();
    }

    @Override
    public String fetchFullText(String url) {
        ResponseEntity<String> resp = rt.getForEntity(URI.create(url), String.class);
        if (!resp.getStatusCode().is2xxSuccessful()) {
            throw new RestClientException("Failed to fetch full text: status=" + resp.getStatusCode());
        }
        return resp.getBody() == null ? "" : resp.getBody();
    }

    private static HttpHeaders jsonHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }
}
