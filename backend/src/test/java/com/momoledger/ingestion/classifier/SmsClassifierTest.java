package com.momoledger.ingestion.classifier;

import com.momoledger.domain.TransactionCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class SmsClassifierTest {

    private final SmsClassifier classifier = new SmsClassifier();

    static Stream<Arguments> typicalBodies() {
        return Stream.of(
                Arguments.of("You have received 2000 RWF from Jane Smith (*********013) on your mobile money account at 2024-05-10 16:30:51.",
                        TransactionCategory.INCOMING_MONEY),
                Arguments.of("TxId: 73214484437. Your payment of 1,000 RWF to Jane Smith 12845 has been completed at 2024-05-10 16:31:39.",
                        TransactionCategory.PAYMENTS_TO_CODE_HOLDERS),
                Arguments.of("*165*S*10000 RWF transferred to Samuel Carter (250791666666) from 36521838 at 2024-05-11 20:34:47 .",
                        TransactionCategory.TRANSFERS_TO_MOBILE_NUMBERS),
                Arguments.of("*113*R*A bank deposit of 40000 RWF has been added at 2024-05-11 18:43:49.",
                        TransactionCategory.BANK_DEPOSITS),
                Arguments.of("Your Airtime purchase of 500 RWF completed.",
                        TransactionCategory.AIRTIME_BILL_PAYMENTS),
                Arguments.of("Your Cash Power token 1234 purchased for 3000 RWF.",
                        TransactionCategory.CASH_POWER_BILL_PAYMENTS),
                Arguments.of("A transaction of 3500 RWF by DIRECT PAYMENT LTD on your MOMO account was successfully completed.",
                        TransactionCategory.TRANSACTIONS_INITIATED_BY_THIRD_PARTIES),
                Arguments.of("You Jane Smith (*********036) have via agent: Agent Sophia (250790777777), withdrawn 20000 RWF.",
                        TransactionCategory.WITHDRAWALS_FROM_AGENTS),
                Arguments.of("You have sent 5000 RWF via bank. External Transaction Id: 9981.",
                        TransactionCategory.BANK_TRANSFERS),
                Arguments.of("You have bought Bundles and Packs of 1GB for 2000 RWF.",
                        TransactionCategory.INTERNET_AND_VOICE_BUNDLE_PURCHASES)
        );
    }

    @ParameterizedTest(name = "{1}")
    @MethodSource("typicalBodies")
    void classifiesEachCategory(String body, TransactionCategory expected) {
        assertThat(classifier.classify(body)).isEqualTo(expected);
    }

    @Test
    @DisplayName("first matching rule wins: received/from beats External Transaction Id")
    void ruleOrder_incomingBeforeBankTransfer() {
        String body = "You have received 5000 RWF from Bank of Kigali (*013). External Transaction Id: 42.";
        assertThat(classifier.classify(body)).isEqualTo(TransactionCategory.INCOMING_MONEY);
    }

    @Test
    @DisplayName("payment-of wording beats Airtime")
    void ruleOrder_paymentBeforeAirtime() {
        String body = "*162*TxId:13913173274*S*Your payment of 2000 RWF to Airtime with token has been completed.";
        assertThat(classifier.classify(body)).isEqualTo(TransactionCategory.PAYMENTS_TO_CODE_HOLDERS);
    }

    @Test
    void bundleRule_isCaseInsensitive() {
        assertThat(classifier.classify("Your INTERNET bundle of 500MB is active"))
                .isEqualTo(TransactionCategory.INTERNET_AND_VOICE_BUNDLE_PURCHASES);
        assertThat(classifier.classify("Voice Bundle activated"))
                .isEqualTo(TransactionCategory.INTERNET_AND_VOICE_BUNDLE_PURCHASES);
    }

    @Test
    @DisplayName("literal rules are case-sensitive")
    void literalRules_areCaseSensitive() {
        assertThat(classifier.classify("AIRTIME topped up")).isEqualTo(TransactionCategory.OTHER);
    }

    @Test
    void thirdPartyRule_needsAccountPhrase() {
        assertThat(classifier.classify("Charged by the operator")).isEqualTo(TransactionCategory.OTHER);
    }

    @Test
    void noRuleMatches_isOther() {
        assertThat(classifier.classify("Hello, your OTP is 1234")).isEqualTo(TransactionCategory.OTHER);
    }

    @Test
    void absentBody_isUnknown() {
        assertThat(classifier.classify(null)).isEqualTo(TransactionCategory.UNKNOWN);
        assertThat(classifier.classify("")).isEqualTo(TransactionCategory.UNKNOWN);
    }

    @Test
    void ruleNamesAreDistinctAndDescriptive() {
        assertThat(SmsClassifier.RULES).extracting(ClassificationRule::name)
                .doesNotHaveDuplicates()
                .allSatisfy(name -> assertThat(name).isNotBlank())
                .contains("received & from", "External Transaction Id", "Bundles and Packs|internet|voice bundle");
    }

    @Test
    void rulesCoverEveryCategoryExceptOtherAndUnknown() {
        assertThat(SmsClassifier.RULES).extracting(ClassificationRule::category)
                .doesNotHaveDuplicates()
                .hasSize(TransactionCategory.values().length - 2)
                .doesNotContain(TransactionCategory.OTHER, TransactionCategory.UNKNOWN);
    }
}
