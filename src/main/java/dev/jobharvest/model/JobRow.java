package dev.jobharvest.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * One output row in sink column order.
 */
public record JobRow(
        String title,
        String company,
        String location,
        String remote,
        String jobType,
        String description,
        String minSalary,
        String maxSalary,
        String applicationLink) {

    public static final List<String> HEADER = List.of(
            "Title",
            "Company Name",
            "Location Name",
            "Remote OK",
            "Job Type",
            "Description",
            "Minimum Salary",
            "Maximum Salary",
            "Application Link");

    public static JobRow from(JobFields fields) {
        return new JobRow(
                nullToEmpty(fields.getTitle()),
                nullToEmpty(fields.getCompanyName()),
                nullToEmpty(fields.getLocation()),
                Boolean.TRUE.equals(fields.getRemoteOk()) ? "TRUE" : "FALSE",
                nullToEmpty(fields.getJobType()),
                nullToEmpty(fields.getDescriptionHtml()),
                formatSalary(fields.getMinSalary()),
                formatSalary(fields.getMaxSalary()),
                nullToEmpty(fields.getApplicationLink()));
    }

    public List<String> cells() {
        return List.of(title, company, location, remote, jobType, description, minSalary, maxSalary,
                applicationLink);
    }

    static String formatSalary(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return "";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
