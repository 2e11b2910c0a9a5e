package dev.jobharvest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Google Sheets sink settings. Obtaining the access token is left to the caller.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "sheets")
public class SheetsProperties {

    private String spreadsheetId;
    private String worksheet = "Jobs";
    private String accessToken;
    private String baseUrl = "https://sheets.googleapis.com";
    private int timeoutSeconds = 30;
}
