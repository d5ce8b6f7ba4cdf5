package org.medquery.configuration;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "medquery")
public class MedQueryProperties {

    private final Security security = new Security();
    private final Language language = new Language();
    private final Query query = new Query();
    private final Seed seed = new Seed();

    @Getter
    @Setter
    public static class Security {
        /** HMAC secret for signing credentials; at least 32 bytes. */
        private String jwtSecret;
        private Duration tokenTtl = Duration.ofHours(8);
    }

    @Getter
    @Setter
    public static class Language {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String defaultModel = "gpt-4o";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Query {
        /** Hard cap on rows returned by one statement, whatever LIMIT the statement carries. */
        private int maxRows = 100;
        /** Rows handed to the language service for narration. */
        private int narrationSampleRows = 20;
        /** Limit on how long one statement may run before the store cancels it. */
        private Duration statementTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Seed {
        private boolean enabled = true;
        private List<SeedUser> users = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class SeedUser {
        private String username;
        private String password;
        private String role;
        private String fullName;
    }
}
