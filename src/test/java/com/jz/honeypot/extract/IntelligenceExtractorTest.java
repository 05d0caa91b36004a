package com.jz.honeypot.extract;

import com.jz.honeypot.domain.IntelKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class IntelligenceExtractorTest {

    private final IntelligenceExtractor extractor = new IntelligenceExtractor();

    @Test
    void paymentAppIdAndPhone() {
        Map<IntelKind, Set<String>> found = extractor.extract("Send money to refund.desk@paytm or call 9876543210");

        assertThat(found).containsOnlyKeys(IntelKind.UPI_ID, IntelKind.PHONE_NUMBER);
        assertThat(found.get(IntelKind.UPI_ID)).containsExactly("refund.desk@paytm");
        assertThat(found.get(IntelKind.PHONE_NUMBER)).containsExactly("+919876543210");
    }

    @Test
    void upiIdsAreLowercased() {
        assertThat(extractor.extract("Pay to Rahul.K@YBL today").get(IntelKind.UPI_ID))
                .containsExactly("rahul.k@ybl");
    }

    @Test
    void mailboxIsEmailNotUpi() {
        Map<IntelKind, Set<String>> found = extractor.extract("Write to support.team@gmail.com for refund");

        assertThat(found).doesNotContainKey(IntelKind.UPI_ID);
        assertThat(found.get(IntelKind.EMAIL)).containsExactly("support.team@gmail.com");
    }

    @Test
    void bankAccountAndIfsc() {
        Map<IntelKind, Set<String>> found =
                extractor.extract("Transfer to account 123456789012 IFSC SBIN0001234");

        assertThat(found.get(IntelKind.BANK_ACCOUNT)).containsExactly("123456789012");
        assertThat(found.get(IntelKind.IFSC_CODE)).containsExactly("SBIN0001234");
        assertThat(found).doesNotContainKey(IntelKind.PHONE_NUMBER);
    }

    @Test
    void mobileNumberAfterAccountKeywordIsNotAnAccount() {
        Map<IntelKind, Set<String>> found = extractor.extract("account 9876543210");

        assertThat(found).doesNotContainKey(IntelKind.BANK_ACCOUNT);
        assertThat(found.get(IntelKind.PHONE_NUMBER)).containsExactly("+919876543210");
    }

    @Test
    void linksAreTrimmedAndNotDuplicated() {
        Map<IntelKind, Set<String>> found =
                extractor.extract("Click http://sbi-kyc-update.xyz/verify now. Or visit bit.ly/abc123.");

        assertThat(found.get(IntelKind.PHISHING_LINK))
                .containsExactlyInAnyOrder("http://sbi-kyc-update.xyz/verify", "bit.ly/abc123");
    }

    @Test
    void whatsappLinkYieldsPhoneToo() {
        Map<IntelKind, Set<String>> found = extractor.extract("message me on wa.me/919876543210");

        assertThat(found.get(IntelKind.PHISHING_LINK)).containsExactly("wa.me/919876543210");
        assertThat(found.get(IntelKind.PHONE_NUMBER)).containsExactly("+919876543210");
    }

    @Test
    void caseIdsNeedADigit() {
        Map<IntelKind, Set<String>> found =
                extractor.extract("Your case number is CBI/2024/7781, complaint id: CMP-99812");

        assertThat(found.get(IntelKind.CASE_ID)).containsExactlyInAnyOrder("CBI/2024/7781", "CMP-99812");
        assertThat(extractor.extract("the reference is pending")).doesNotContainKey(IntelKind.CASE_ID);
    }

    @Test
    void nothingToFind() {
        assertThat(extractor.extract("hello, how are you?")).isEmpty();
        assertThat(extractor.extract("   ")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "'+91 98765 43210', +919876543210",
            "09876543210, +919876543210",
            "919876543210, +919876543210",
            "9876543210, +919876543210"
    })
    void phoneFormsNormalise(String raw, String expected) {
        assertThat(IntelligenceExtractor.normalizePhone(raw)).isEqualTo(expected);
    }

    @Test
    void nonMobileNumbersAreRejected() {
        assertThat(IntelligenceExtractor.normalizePhone("5876543210")).isNull();
        assertThat(IntelligenceExtractor.normalizePhone("12345")).isNull();
    }
}
