package com.momoledger.ingestion.archive;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * XML shape of an SMS Backup &amp; Restore export: {@code <smses count="n"><sms address=".." body=".." .../></smses>}.
 * Each {@code sms} element is kept as its raw attribute map.
 */
@JacksonXmlRootElement(localName = "smses")
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@Getter
@Setter
public class SmsArchiveDocument {

    @JacksonXmlProperty(isAttribute = true)
    private Integer count;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "sms")
    private List<Map<String, String>> messages = new ArrayList<>();
}
