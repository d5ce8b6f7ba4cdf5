package org.medquery.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

@Configuration
public class LanguageServiceConfiguration {

    @Bean
    public RestClient languageServiceRestClient(RestClient.Builder builder, MedQueryProperties properties) {
        MedQueryProperties.Language language = properties.getLanguage();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) language.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) language.getReadTimeout().toMillis());

        RestClient.Builder configured = builder
                .baseUrl(language.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(language.getApiKey())) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + language.getApiKey());
        }
        return configured.build();
    }
}
