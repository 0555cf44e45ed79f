package com.nola.analytics.domain.model;

import lombok.Value;

/**
 * Rendered CSV report ready to be sent as an attachment.
 */
@Value
public class CsvReport {

    String filename;
    byte[] content;
}
