package com.jz.honeypot.engage;

import com.jz.honeypot.domain.IntelKind;

import java.util.List;
import java.util.Map;

import static com.jz.honeypot.detect.SignalLayers.*;

/**
 * 质量探针的素材：红旗表态（按类别）、调查提问、索取信息、连接词。
 */
final class ProbeTemplates {

    private ProbeTemplates() {
    }

    static final List<String> GENERIC_RED_FLAGS = List.of(
            "Something about this call does not feel right to me.",
            "I have been warned about calls exactly like this one.",
            "You are asking for things my bank told me never to share.",
            "None of this matches what my branch manager told me last month."
    );

    static final Map<String, List<String>> RED_FLAGS = Map.ofEntries(
            Map.entry(URGENCY, List.of(
                    "All this hurry is making me uncomfortable.",
                    "Why such a rush? Real matters are never this pressured.",
                    "This time pressure is making me anxious, I want to slow down.")),
            Map.entry(OTP, List.of(
                    "My bank always says an OTP must never be shared with anyone.",
                    "Asking for my OTP on a call worries me a lot.",
                    "My son told me nobody genuine ever asks for the OTP.")),
            Map.entry(PAYMENT, List.of(
                    "Paying money first before getting anything does not sound right.",
                    "Real organisations don't ask for transfers like this.",
                    "This demand for payment makes me suspicious.")),
            Map.entry(BANK_DETAIL, List.of(
                    "Sending money to a personal UPI ID instead of the bank is strange.",
                    "A government office would not use a private account like this.")),
            Map.entry(AUTHORITY, List.of(
                    "You say you are from a government office but I have no way to verify that.",
                    "I have heard that people pretend to be officials on the phone.",
                    "Real officers send written notices before calling anyone.")),
            Map.entry(SUSPENSION, List.of(
                    "Threatening to block my account over the phone seems excessive.",
                    "My bank has never threatened me like this before.")),
            Map.entry(LEGAL, List.of(
                    "Arrest threats over a phone call seem very strange to me.",
                    "Real legal matters come by post, not by phone calls.")),
            Map.entry(DIGITAL_ARREST, List.of(
                    "I have never heard of anyone being arrested on a video call.",
                    "Keeping me on the call and away from my family sounds wrong.")),
            Map.entry(PHISHING, List.of(
                    "This link does not look like an official website to me.",
                    "My grandson warned me never to open links from unknown people.")),
            Map.entry(COURIER, List.of(
                    "I have not ordered anything that needs customs clearance.",
                    "A parcel with drugs in my name sounds like the scam on the news.")),
            Map.entry(TECH_SUPPORT, List.of(
                    "Companies don't usually call people about viruses on their phone.",
                    "Giving remote access to a stranger makes me very nervous.")),
            Map.entry(JOB_LOAN, List.of(
                    "Paying a fee to get a job or a loan does not sound genuine.",
                    "Easy money offers like this are usually too good to be true.")),
            Map.entry(INVESTMENT, List.of(
                    "Guaranteed returns sound unrealistic, every investment has risk.",
                    "Doubling money schemes are exactly what the fraud warnings talk about.")),
            Map.entry(PRIZE, List.of(
                    "I never entered any lottery, so how could I win a prize?",
                    "Why would I pay a fee to receive a prize?")),
            Map.entry(IDENTITY, List.of(
                    "Sharing my Aadhaar and PAN on the phone makes me uncomfortable.",
                    "I have been told never to share ID documents with strangers.")),
            Map.entry(EMOTIONAL, List.of(
                    "I feel like you are trying to scare me.",
                    "Bringing my family into this is making me uneasy."))
    );

    static final List<String> INVESTIGATIVE = List.of(
            "What is your full name and employee ID? I need it for my records.",
            "Which department are you calling from, and what is the department code?",
            "What is the case reference number for this matter?",
            "Who is your supervisor, and how can I reach them?",
            "What is your official website address? I want to check it myself.",
            "Please tell me your office address and branch location.",
            "What is your badge number or official designation?",
            "Can you give me a callback number and your direct extension?",
            "Which government ministry issued this notice, and what is the notice number?",
            "What is the official toll-free number I can use to verify this call?",
            "Can you send this on your official email? What is the email ID?",
            "What is the registration number of your organisation?"
    );

    static final List<String> ELICITATION = List.of(
            "What is the beneficiary name and the bank branch?",
            "Spell out the account number for me, and the IFSC code also.",
            "Tell me the exact UPI ID letter by letter, I am writing it down.",
            "Give me your direct contact number in case we get disconnected.",
            "What email should I send the documents to?",
            "What is the exact amount I need to send? Please confirm the figure.",
            "What is the account holder's full name as registered with the bank?",
            "Give me the reference number I should quote in the payment remarks.",
            "Which bank is the receiving account in, and which city is the branch?",
            "What is your registered mobile number on this account?",
            "Tell me the order ID or transaction reference again for my records."
    );

    static final List<String> CONNECTORS = List.of(
            " Also, ",
            " And one more thing, ",
            " By the way, ",
            " While we are on this, ",
            " Before I forget, "
    );

    /** 模板里出现这些词，说明它在索要对应类型的情报 */
    static final Map<IntelKind, List<String>> INTEL_KEYWORDS = Map.of(
            IntelKind.PHONE_NUMBER, List.of("phone number", "contact number", "mobile number",
                    "callback number", "direct number", "registered mobile", "toll-free number"),
            IntelKind.UPI_ID, List.of("upi id", "upi address"),
            IntelKind.BANK_ACCOUNT, List.of("account number", "ifsc", "bank account", "beneficiary",
                    "account holder", "receiving account"),
            IntelKind.EMAIL, List.of("email")
    );
}
