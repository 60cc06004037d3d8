package com.momoledger.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One message as read from the SMS archive. Never mutated by the pipeline.
 * {@code attributes} holds every attribute of the archive element, named ones included, in archive order.
 */
@Value
@Builder
public class RawSms {

    public static final String ADDRESS = "address";
    public static final String BODY = "body";
    public static final String TYPE = "type";
    public static final String READABLE_DATE = "readable_date";
    public static final String CONTACT_NAME = "contact_name";

    String address;
    String body;
    String type;
    /** Human-formatted timestamp from the backup tool, e.g. "10 May 2024 4:30:58 PM". */
    String readableDate;
    String contactName;
    Map<String, String> attributes;

    public static RawSms fromAttributes(Map<String, String> attributes) {
        Map<String, String> copy = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        return RawSms.builder()
                .address(copy.get(ADDRESS))
                .body(copy.get(BODY))
                .type(copy.get(TYPE))
                .readableDate(copy.get(READABLE_DATE))
                .contactName(copy.get(CONTACT_NAME))
                .attributes(copy)
                .build();
    }

    /** True when the body is missing or empty; such messages classify as {@link TransactionCategory#UNKNOWN}. */
    public boolean hasBody() {
        return body != null && !body.isEmpty();
    }
}
