package dev.jobharvest.service;

import dev.jobharvest.model.JobFields;
import dev.jobharvest.util.UrlUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes extracted fields before they become a row.
 */
@Component
public class FieldPostprocessor {

    private static final Pattern REMOTE_PATTERN = Pattern.compile(
            "\\b(remote|work from anywhere|wfh|hybrid)\\b", Pattern.CASE_INSENSITIVE);

    private static final List<String> FULL_TIME = List.of("full-time", "full time", "permanent");
    private static final List<String> PART_TIME = List.of("part-time", "part time");
    private static final List<String> INTERNSHIP = List.of("intern", "co-op", "internship");

    /**
     * Applies remote detection, company override, job-type normalization and
     * application-link sanitization to {@code fields} in place.
     *
     * @param fields          fields owned by the calling worker
     * @param companyOverride replaces the company name when non-blank
     * @param pageHtml        raw markup scanned when the remote flag is unknown
     * @param jobUrl          candidate URL
     * @param canonicalUrl    canonical URL of the posting
     * @return {@code fields}
     */
    public JobFields apply(JobFields fields, String companyOverride, String pageHtml, String jobUrl,
                           String canonicalUrl) {
        if (fields.getRemoteOk() == null) {
            fields.setRemoteOk(detectRemote(pageHtml));
        }
        if (companyOverride != null && !companyOverride.isBlank()) {
            fields.setCompanyName(companyOverride);
        }
        String jobType = normalizeJobType(fields.getJobType());
        if (jobType != null) {
            fields.setJobType(jobType);
        }
        fields.setApplicationLink(sanitizeApplicationLink(fields.getApplicationLink(), jobUrl, canonicalUrl));
        return fields;
    }

    public static boolean detectRemote(String text) {
        return text != null && !text.isEmpty() && REMOTE_PATTERN.matcher(text).find();
    }

    /**
     * Maps free-text employment type to "Full Time", "Part Time" or "Internship";
     * null when nothing matches.
     */
    public static String normalizeJobType(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.strip().toLowerCase(Locale.ROOT);
        if (FULL_TIME.stream().anyMatch(v::contains)) {
            return "Full Time";
        }
        if (PART_TIME.stream().anyMatch(v::contains)) {
            return "Part Time";
        }
        if (INTERNSHIP.stream().anyMatch(v::contains)) {
            return "Internship";
        }
        return null;
    }

    /**
     * Keeps absolute http(s) and mailto links, resolves schemeless ones against the
     * canonical (or job) URL, and falls back to the canonical (or job) URL otherwise.
     */
    public static String sanitizeApplicationLink(String link, String jobUrl, String canonicalUrl) {
        String base = canonicalUrl != null && !canonicalUrl.isBlank() ? canonicalUrl : jobUrl;
        String candidate = link == null ? "" : link.strip();
        if (!candidate.isEmpty()) {
            String scheme = UrlUtils.schemeOf(candidate);
            if (("http".equals(scheme) || "https".equals(scheme)) && UrlUtils.hostOf(candidate) != null) {
                return candidate;
            }
            if ("mailto".equals(scheme)) {
                return candidate;
            }
            if (scheme == null) {
                if (base == null || base.isBlank()) {
                    return candidate;
                }
                String resolved = UrlUtils.resolve(base, candidate);
                return resolved != null ? resolved : candidate;
            }
        }
        return base == null ? "" : base;
    }
}
