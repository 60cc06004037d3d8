package com.momoledger.ingestion.archive;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.momoledger.domain.RawSms;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads the whole SMS archive into memory, in archive order.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SmsArchiveReader {

    private final XmlMapper archiveXmlMapper;

    /**
     * @throws ArchiveReadException if the file is missing, unreadable or not an SMS archive
     */
    public List<RawSms> read(Path archive) {
        if (archive == null) {
            throw new ArchiveReadException("No SMS archive path configured");
        }
        SmsArchiveDocument document;
        try (InputStream in = Files.newInputStream(archive)) {
            document = archiveXmlMapper.readValue(in, SmsArchiveDocument.class);
        } catch (NoSuchFileException e) {
            throw new ArchiveReadException("SMS archive not found: " + archive, e);
        } catch (JsonMappingException e) {
            throw new ArchiveReadException("SMS archive " + archive + " is not a valid smses document: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ArchiveReadException("Failed to read SMS archive " + archive + ": " + e.getMessage(), e);
        }
        if (document == null) {
            throw new ArchiveReadException("SMS archive " + archive + " is empty");
        }
        List<Map<String, String>> elements = document.getMessages() != null ? document.getMessages() : List.of();
        List<RawSms> out = new ArrayList<>(elements.size());
        for (Map<String, String> attributes : elements) {
            out.add(RawSms.fromAttributes(attributes));
        }
        if (document.getCount() != null && document.getCount() != out.size()) {
            log.warn("SMS archive {} declares count={} but contains {} sms element(s)", archive, document.getCount(), out.size());
        }
        log.info("Loaded {} message(s) from {}", out.size(), archive);
        return out;
    }
}
