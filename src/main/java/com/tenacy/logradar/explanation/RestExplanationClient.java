package com.tenacy.logradar.explanation;

import com.tenacy.logradar.config.ExplanationProperties;
import com.tenacy.logradar.exception.TransientIOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * 설정된 엔드포인트로 이상 정보를 POST 하고 응답의 explanation 필드를 꺼낸다.
 */
@Slf4j
@Component
public class RestExplanationClient implements ExplanationClient {

    private final ExplanationProperties properties;
    private final RestClient restClient;

    public RestExplanationClient(ExplanationProperties properties, RestClient.Builder restClientBuilder) {
        this.properties = properties;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getTimeout().toMillis());

        this.restClient = restClientBuilder
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public boolean isEnabled() {
        return properties.isEnabled() && StringUtils.hasText(properties.getEndpoint());
    }

    @Override
    public String explain(ExplanationRequest request) {
        try {
            ExplanationResponse response = restClient.post()
                    .uri(properties.getEndpoint())
                    .headers(headers -> {
                        if (StringUtils.hasText(properties.getApiKey())) {
                            headers.setBearerAuth(properties.getApiKey());
                        }
                    })
                    .body(request)
                    .retrieve()
                    .body(ExplanationResponse.class);

            if (response == null || !StringUtils.hasText(response.getExplanation())) {
                throw new TransientIOException("explanation service returned an empty response");
            }
            return response.getExplanation();
        } catch (RestClientException e) {
            throw new TransientIOException("explanation request failed: " + e.getMessage(), e);
        }
    }
}
