package dev.jobharvest.model;

/**
 * Fields produced by one extraction tier for a candidate URL.
 *
 * @param fields       extracted fields, owned by the worker processing the candidate
 * @param canonicalUrl canonical URL of the posting
 * @param pageHtml     raw markup used for remote detection, may be empty
 * @param extractor    name of the tier or parser that produced the fields
 */
public record ExtractedJob(JobFields fields, String canonicalUrl, String pageHtml, String extractor) {

    public ExtractedJob {
        pageHtml = pageHtml == null ? "" : pageHtml;
    }
}
