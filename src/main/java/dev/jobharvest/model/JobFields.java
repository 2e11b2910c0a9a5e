package dev.jobharvest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured fields of one job posting. Serialized in snake_case to match the
 * extraction schema.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobFields {
    private String title;
    private String companyName;
    private String location;
    private Boolean remoteOk; // null = unknown
    private String jobType;
    private String descriptionHtml;
    private Double minSalary;
    private Double maxSalary;
    private String applicationLink;
}
