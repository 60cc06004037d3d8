package com.momoledger.ingestion.extractor;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls single typed values out of a mobile-money SMS body.
 * Every method returns empty when nothing matches; none of them throws on malformed text.
 */
public final class SmsFieldExtractor {

    /** Currency marker used in the message texts and stored on every transaction. */
    public static final String CURRENCY = "RWF";

    private static final Pattern AMOUNT = Pattern.compile("(\\d+)\\s*" + CURRENCY);
    private static final Pattern EMBEDDED_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}");
    private static final Pattern FEE = Pattern.compile(
            "Fee (?:was|paid):?\\s*([\\d,]+)\\s*" + CURRENCY, Pattern.CASE_INSENSITIVE);
    private static final Pattern BALANCE = Pattern.compile(
            "balance:?\\s*([\\d,]+)\\s*" + CURRENCY, Pattern.CASE_INSENSITIVE);
    private static final Pattern TRANSACTION_ID = Pattern.compile("Transaction Id:?\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TX_ID = Pattern.compile("TxId:?\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXTERNAL_TRANSACTION_ID = Pattern.compile(
            "External Transaction Id:?\\s*([\\w-]+)", Pattern.CASE_INSENSITIVE);

    static final DateTimeFormatter EMBEDDED_DATE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);

    private SmsFieldExtractor() {
    }

    /** First number followed by the currency marker; thousands separators are ignored ("2,000 RWF" = 2000). */
    public static Optional<Long> extractAmount(String body) {
        if (body == null || body.isEmpty()) return Optional.empty();
        Matcher m = AMOUNT.matcher(body.replace(",", ""));
        return m.find() ? parseWholeUnits(m.group(1)) : Optional.empty();
    }

    /** First {@code yyyy-MM-dd HH:mm:ss} token, read as UTC. */
    public static Optional<Instant> extractDate(String body) {
        if (body == null || body.isEmpty()) return Optional.empty();
        Matcher m = EMBEDDED_DATE.matcher(body);
        if (!m.find()) return Optional.empty();
        try {
            return Optional.of(LocalDateTime.parse(m.group(), EMBEDDED_DATE_FORMAT).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static Optional<Long> extractFee(String body) {
        return firstGroup(FEE, body).flatMap(SmsFieldExtractor::parseWholeUnits);
    }

    public static Optional<Long> extractBalance(String body) {
        return firstGroup(BALANCE, body).flatMap(SmsFieldExtractor::parseWholeUnits);
    }

    /** "Transaction Id" label first, then "TxId". */
    public static Optional<String> extractTransactionId(String body) {
        Optional<String> id = firstGroup(TRANSACTION_ID, body);
        return id.isPresent() ? id : firstGroup(TX_ID, body);
    }

    public static Optional<String> extractExternalTransactionId(String body) {
        return firstGroup(EXTERNAL_TRANSACTION_ID, body);
    }

    private static Optional<String> firstGroup(Pattern pattern, String body) {
        if (body == null || body.isEmpty()) return Optional.empty();
        Matcher m = pattern.matcher(body);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    static Optional<Long> parseWholeUnits(String digits) {
        if (digits == null) return Optional.empty();
        String plain = digits.replace(",", "");
        if (plain.isEmpty()) return Optional.empty();
        try {
            return Optional.of(Long.parseLong(plain));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
