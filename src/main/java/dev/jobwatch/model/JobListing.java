package dev.jobwatch.model;

import lombok.Builder;
import lombok.Value;

/**
 * One row of the source listing table.
 */
@Value
@Builder
public class JobListing {
    String serialNumber;
    String postName;
    String department;
    String caseNumber;
    String advertisementNumber;
    String closingDate; // day-month-year as shown on the site
    String status;
    String detailLink;
}
