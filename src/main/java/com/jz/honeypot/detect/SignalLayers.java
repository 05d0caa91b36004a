package com.jz.honeypot.detect;

import java.util.List;
import java.util.regex.Pattern;

import static com.jz.honeypot.detect.SignalRule.of;

/**
 * 内置的 20 个信号层：12 个核心类别 + 8 个辅助层（复合话术、行为升级、地区语言等）。
 */
public final class SignalLayers {

    private SignalLayers() {
    }

    public static final String URGENCY = "urgency";
    public static final String AUTHORITY = "authority_impersonation";
    public static final String OTP = "otp_request";
    public static final String PAYMENT = "payment_request";
    public static final String SUSPENSION = "account_suspension";
    public static final String LEGAL = "legal_threat";
    public static final String PHISHING = "phishing_link";
    public static final String COURIER = "courier_lure";
    public static final String JOB_LOAN = "job_loan_lure";
    public static final String DIGITAL_ARREST = "digital_arrest";
    public static final String IDENTITY = "identity_document";
    public static final String BANK_DETAIL = "bank_detail";

    public static final String COMPOUND = "compound_template";
    public static final String ESCALATION = "behavioral_escalation";
    public static final String EMOTIONAL = "emotional_pressure";
    public static final String PRIZE = "prize_lure";
    public static final String TECH_SUPPORT = "tech_support";
    public static final String INVESTMENT = "investment_lure";
    public static final String HINDI = "regional_hindi";
    public static final String HINGLISH = "regional_hinglish";

    // 纯问候（仅首轮生效）
    public static final List<Pattern> GREETINGS = List.of(
            Pattern.compile("^\\s*(hello|hi|hey|namaste|namaskar|good\\s*(morning|afternoon|evening|day))[\\s!.,?]*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^\\s*(greetings|howdy|salam|jai\\s*hind)[\\s!.,?]*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^\\s*(how\\s*are\\s*you|hope\\s*you.?re\\s*well|are\\s*you\\s*there)[\\s?.!]*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^\\s*(dear\\s*(sir|ma.?am|customer|user|friend))[\\s,!.]*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^\\s*(welcome|thank\\s*you|thanks)[\\s!.,?]*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^\\s*(kaise\\s*ho|kya\\s*haal|theek\\s*ho|sab\\s*theek)[\\s?!.]*$", Pattern.CASE_INSENSITIVE)
    );

    public static List<SignalLayer> defaults() {
        return List.of(
                // ---------- core ----------
                core(URGENCY, List.of(
                        of("urgent", "\\b(urgent|urgently|immediate(ly)?|right\\s*now|asap)\\b", 12),
                        of("hurry", "\\b(hurry|quickly|rush)\\b", 10),
                        of("window", "\\b(within\\s*\\d+\\s*(hour|minute|min|hr|day)s?|today\\s*only)\\b", 14),
                        of("last-chance", "\\b(last\\s*chance|final\\s*(notice|warning|chance)|expir(e|es|ed|ing))\\b", 16),
                        of("deadline", "\\b(deadline|time\\s*(is\\s*)?(running|left|short))\\b", 12),
                        of("act-now", "\\b(act\\s*now|don.t\\s*wait|limited\\s*time|time\\s*sensitive)\\b", 14),
                        of("slots-left", "\\b(only|just)\\s*\\d+\\s*(hour|minute|min|slot|seat)s?\\s*(left|remaining)\\b", 16)
                )),
                core(AUTHORITY, List.of(
                        of("rbi", "\\b(rbi|reserve\\s*bank(\\s*of\\s*india)?)\\b", 18),
                        of("police", "\\b(police|cbi|enforcement\\s*directorate|narcotics\\s*(bureau|department)|ncb)\\b", 18),
                        of("tax", "\\b(income\\s*tax|it\\s*department)\\b", 16),
                        of("telecom", "\\b(trai|department\\s*of\\s*telecom(munications)?)\\b", 16),
                        of("cyber-cell", "\\bcyber\\s*(cell|crime|police|branch)\\b", 16),
                        of("court", "\\b(supreme\\s*court|high\\s*court|court\\s*order)\\b", 16),
                        of("govt", "\\b(customs|ministry|government|govt|uidai|npci|sebi)\\b", 14),
                        of("officer", "\\b(officer|inspector|commissioner|superintendent)\\b", 12),
                        of("bank-brand", "\\b(sbi|state\\s*bank|hdfc|icici|axis\\s*bank|kotak|pnb)\\b", 10),
                        of("telco-brand", "\\b(airtel|jio|vodafone|bsnl)\\b", 10)
                )),
                core(OTP, List.of(
                        of("otp", "\\b(otp|one\\s*time\\s*password|verification\\s*code)\\b", 20),
                        of("share-otp", "\\b(share|send|tell|give|provide|forward)\\s*(me\\s*)?(the\\s*)?(your\\s*)?(otp|code|pin)\\b", 25),
                        of("read-otp", "\\bread\\s*(out|me)\\s*(the\\s*)?(otp|code|number)\\b", 25),
                        of("n-digit", "\\b\\d[\\s-]?digit\\s*(code|otp|pin|password|number)\\b", 22),
                        of("card-secret", "\\b(cvv|atm\\s*pin|card\\s*pin|mpin|upi\\s*pin)\\b", 22),
                        of("enter-code", "\\b(enter|type|input|submit)\\s*(the\\s*)?(otp|code|pin)\\b", 22)
                )),
                core(PAYMENT, List.of(
                        of("send-money", "\\b(send|transfer|pay)\\s*(me|us|the|now|rs|₹|\\d+)", 18),
                        of("fee", "\\b(processing|registration|clearance|verification|handling)\\s*(fee|charge)s?\\b", 20),
                        of("pay-now", "\\b(pay\\s*now|transfer\\s*now|send\\s*money|make\\s*(the\\s*)?payment)\\b", 18),
                        of("deposit", "\\b(security\\s*deposit|advance\\s*payment|token\\s*amount)\\b", 18),
                        of("refund", "\\b(refund|cashback|reward)\\s*(of|is|amount|pending|process)", 16),
                        of("amount-due", "\\b(amount|money|payment)\\s*(of|is|due|required|pending)\\b", 14),
                        of("rupees", "(\\b(rs\\.?|inr)\\s*\\d[\\d,]*|₹\\s*\\d[\\d,]*|\\b\\d[\\d,]*\\s*(rs|rupees?|inr)\\b)", 12),
                        of("rails", "\\b(neft|rtgs|imps|wire\\s*transfer)\\b", 10)
                )),
                core(SUSPENSION, List.of(
                        of("account-block", "\\b(account|a/c)\\s*(will\\s*be\\s*|has\\s*been\\s*|is\\s*)?(suspend|block|deactivat|freez|terminat|clos|lock)\\w*", 18),
                        of("kyc", "\\b(kyc|ekyc|re-?kyc)\\s*(update|expir|fail|mandatory|required|pending|incomplete|verif)\\w*", 18),
                        of("card-block", "\\b(card|debit\\s*card|credit\\s*card)\\s*(is\\s*|will\\s*be\\s*|has\\s*been\\s*)(block|suspend|deactivat|freez)\\w*", 18),
                        of("sim-block", "\\b(sim|number|mobile)\\s*(will\\s*be\\s*)?(block|deactivat|suspend|disconnect)\\w*", 16),
                        of("unauthorized", "\\b(unauthori[sz]ed|suspicious)\\s*(access|transaction|activity|login)\\b", 16),
                        of("compromised", "\\b(compromised|hacked|breached)\\b", 16)
                )),
                core(LEGAL, List.of(
                        of("arrest", "\\b(arrest(ed)?|warrant|fir)\\b", 16),
                        of("jail", "\\b(jail|prison|custody|detention)\\b", 18),
                        of("legal-action", "\\blegal\\s*(action|notice|proceedings?)\\b", 16),
                        of("laundering", "\\b(money\\s*laundering|terror(ist)?\\s*funding|hawala|drug\\s*trafficking)\\b", 20),
                        of("criminal", "\\b(non-?bailable|criminal\\s*(case|offence|charge))\\b", 18),
                        of("case-filed", "\\b(case\\s*(is\\s*)?(filed|registered|pending)|under\\s*investigation)\\b", 16),
                        of("penalty", "\\b(penalty|fine|prosecution)\\b", 14),
                        of("seize", "\\b(seize|confiscate|attach|freeze)\\s*(your\\s*)?(property|assets?|accounts?)\\b", 16)
                )),
                core(PHISHING, List.of(
                        of("url", "https?://\\S+", 12),
                        of("shortener", "\\b(bit\\.ly|tinyurl|goo\\.gl|rb\\.gy|is\\.gd|cutt\\.ly|tiny\\.cc)\\b", 16),
                        of("click", "\\b(click|tap)\\s*(here|this|below|on\\s*the\\s*link|the\\s*link)\\b", 14),
                        of("cheap-tld", "\\b[a-z0-9-]+\\.(xyz|top|online|site|click|live|club|icu|buzz)\\b", 14),
                        of("lookalike", "[a-z0-9-]*(secure|verify|account|update|login|claim)[a-z0-9-]*\\.(in|com|org|net)\\b", 16),
                        of("apk", "\\b(apk|\\.exe)\\b|\\binstall\\s*(this|the|our)\\s*app\\b", 16)
                )),
                core(COURIER, List.of(
                        of("parcel-seized", "\\b(parcel|courier|package|shipment|consignment).{0,30}(seiz|held|illegal|drugs|contraband|suspicious)", 20),
                        of("contraband", "\\b(drugs?|contraband|illegal\\s*items?).{0,30}(found|detected|seized)", 20),
                        of("customs-fee", "\\bcustoms?\\s*(duty|clearance|fee|charge)\\b", 14),
                        of("carrier", "\\b(fedex|dhl|blue\\s*dart|dtdc|india\\s*post)\\b", 12),
                        of("tracking", "\\b(tracking|consignment)\\s*(number|id|no)\\b", 10)
                )),
                core(JOB_LOAN, List.of(
                        of("wfh", "\\b(work\\s*from\\s*home|online\\s*(job|earning|income)|part[\\s-]?time\\s*job)\\b", 14),
                        of("earn", "\\bearn\\s*(from\\s*home|daily|weekly|monthly|lakhs?|thousands?)\\b", 16),
                        of("task", "\\b(task[\\s-]?based|per[\\s-]?task|product\\s*review|like\\s*and\\s*subscribe)\\b", 14),
                        of("training-fee", "\\b(training|joining)\\s*(fee|charge)\\b", 18),
                        of("instant-loan", "\\b(instant|pre-?approved)\\s*(loan|credit)\\b", 16),
                        of("no-cibil", "\\bno\\s*(cibil|credit\\s*score|collateral|documents?)\\s*(needed|required|check)\\b", 18),
                        of("loan-offer", "\\bloan\\s*(approved|sanction\\w*|offer|disburs\\w*)\\b", 14)
                )),
                core(DIGITAL_ARREST, List.of(
                        of("digital-arrest", "\\b(digital|online|virtual)\\s*arrest\\b", 25),
                        of("stay-on-call", "\\b(stay\\s*on\\s*(the\\s*)?(call|video|line)|don.t\\s*(disconnect|hang\\s*up))\\b", 18),
                        of("video-statement", "\\bvideo\\s*(call|statement|verification)\\b.{0,40}\\b(police|officer|court|cbi)\\b", 20),
                        of("skype", "\\b(skype|zoom)\\s*(call|interrogation|hearing)\\b", 18),
                        of("isolation", "\\b(do\\s*not|don.t)\\s*(tell|inform)\\s*(anyone|family|anybody)\\b", 16)
                )),
                core(IDENTITY, List.of(
                        of("aadhaar", "\\b(aadhaar|aadhar)\\s*(number|no|card|details|copy)\\b", 14),
                        of("pan", "\\bpan\\s*(card|number|no|details)\\b", 14),
                        of("other-id", "\\b(voter\\s*id|driving\\s*licen[cs]e|passport\\s*(number|no|details))\\b", 14),
                        of("dob", "\\b(date\\s*of\\s*birth|dob|mother.?s?\\s*maiden\\s*name)\\b", 12),
                        of("selfie", "\\b(selfie|photo)\\s*(of|with)\\s*(your|the)\\s*(aadhaar|pan|id)\\b", 16),
                        of("share-id", "\\bshare\\s*(your\\s*)?(aadhaar|pan|voter|passport|id)\\s*(number|details|copy|photo)\\b", 18)
                )),
                core(BANK_DETAIL, List.of(
                        of("vpa", "[\\w.-]+@(paytm|ybl|oksbi|okaxis|okicici|okhdfcbank|upi|phonepe|gpay|ibl|axl|apl|airtel|jio|kotak|sbi|hdfc|icici|pnb|axisbank)\\b", 16),
                        of("upi-id", "\\b(upi\\s*(id|address|handle)|bhim\\s*id|vpa)\\b", 12),
                        of("account-number", "\\b(account|a/c)\\s*(number|no\\.?)\\b", 14),
                        of("ifsc", "\\bifsc\\b|\\b[a-z]{4}0[a-z0-9]{6}\\b", 14),
                        of("beneficiary", "\\bbeneficiary\\s*(name|account|details)?\\b", 12),
                        of("card-number", "\\b(card\\s*number|expiry\\s*date|net\\s*banking\\s*(password|id))\\b", 18),
                        of("qr", "\\b(scan\\s*(the\\s*)?qr|qr\\s*code|collect\\s*request)\\b", 12)
                )),

                // ---------- auxiliary ----------
                aux(COMPOUND, List.of(
                        of("block-then-otp", "\\b(block|suspend|deactivat|freez)\\w*.{0,60}\\b(otp|pin|verify|verification)\\b", 14),
                        of("kyc-link", "\\bkyc\\b.{0,40}\\b(link|click|update\\s*now)\\b", 14),
                        of("parcel-police", "\\b(parcel|package)\\b.{0,60}\\b(drugs|illegal)\\b.{0,60}\\b(police|cbi|narcotics)\\b", 18),
                        of("refund-pin", "\\b(refund|cashback)\\b.{0,40}\\b(pin|scan|approve)\\b", 16),
                        of("prize-fee", "\\b(won|prize|lottery)\\b.{0,60}\\b(fee|charge|tax|pay)\\b", 16)
                )),
                aux(ESCALATION, List.of(
                        of("call-me", "\\b(call|contact|whatsapp)\\s*(me\\s*)?(on|at)?\\s*(\\+?91[\\s-]?)?[6-9]\\d{9}\\b", 12),
                        of("why-delay", "\\bwhy\\s*(are\\s*you\\s*)?(not\\s*)?(responding|replying|delaying|wasting)\\b", 12),
                        of("asking-again", "\\b(i\\s*am\\s*asking\\s*(you\\s*)?again|last\\s*time\\s*i\\s*am\\s*telling|for\\s*the\\s*last\\s*time)\\b", 14),
                        of("do-it-now", "\\b(do\\s*it|send\\s*it|share\\s*it)\\s*(now|immediately|fast)\\b", 12),
                        of("are-you-there", "\\b(hello\\?+|are\\s*you\\s*there\\?+|reply\\s*(fast|now|immediately))", 8)
                )),
                aux(EMOTIONAL, List.of(
                        of("family", "\\byour\\s*(family|children|parents?|wife|husband|reputation|career|future)\\b", 12),
                        of("shame", "\\b(embarrass\\w*|shame|disgrace|humiliat\\w*)\\b", 12),
                        of("secret", "\\b(confidential|secret|between\\s*us)\\b", 10),
                        of("fear", "\\b(scared|afraid|danger(ous)?|ruin(ed)?|destroy(ed)?)\\b", 10),
                        of("trust-me", "\\b(trust\\s*me|believe\\s*me|rest\\s*assured)\\b", 6),
                        of("no-choice", "\\b(no\\s*(choice|option|way\\s*out)|only\\s*(i|we)\\s*can\\s*help)\\b", 12)
                )),
                aux(PRIZE, List.of(
                        of("won", "\\b(won|winner|congratulation\\w*)\\b", 16),
                        of("lottery", "\\b(prize|lottery|lucky\\s*draw|jackpot|bumper\\s*draw)\\b", 18),
                        of("claim", "\\b(claim|collect|redeem)\\s*(your\\s*)?(prize|reward|money|amount|gift)\\b", 16),
                        of("kbc", "\\b(kbc|kaun\\s*banega\\s*crorepati)\\b", 20),
                        of("free-gift", "\\bfree\\s*(gift|iphone|laptop|car|gold|trip)\\b", 16),
                        of("selected", "\\b(selected|chosen|shortlisted)\\s*(for|as)\\b", 14)
                )),
                aux(TECH_SUPPORT, List.of(
                        of("remote-tool", "\\b(anydesk|teamviewer|quicksupport|ultraviewer|remote\\s*desktop)\\b", 20),
                        of("screen-share", "\\b(screen\\s*shar(e|ing)|remote\\s*(access|control|connection))\\b", 18),
                        of("virus", "\\b(virus|malware|trojan|spyware|ransomware)\\b.{0,20}\\b(detected|found|infected|attack)", 18),
                        of("device-hacked", "\\b(computer|system|device|laptop|pc|phone)\\b.{0,20}\\b(hacked|compromised|infected)\\b", 18),
                        of("vendor-support", "\\b(microsoft|apple|google|windows)\\b.{0,15}\\b(support|helpdesk|security)\\b", 16),
                        of("security-alert", "\\b(antivirus|firewall|security\\s*(alert|warning|scan))\\b", 14)
                )),
                aux(INVESTMENT, List.of(
                        of("guaranteed", "\\b(guaranteed\\s*returns?|double\\s*your\\s*money|high\\s*returns?)\\b", 18),
                        of("multiply", "\\b(double|triple|10x|100x)\\s*(your\\s*)?(money|investment|capital)\\b", 20),
                        of("crypto", "\\b(invest\\w*|trading|forex|crypto|bitcoin)\\b.{0,30}\\b(guaranteed|profit|returns?|income)\\b", 18),
                        of("risk-free", "\\b(risk[\\s-]?free|zero\\s*risk|no\\s*risk)\\b", 18),
                        of("tips", "\\b(stock\\s*tips?|insider\\s*(info|tip)|ipo\\s*allotment)\\b", 14),
                        of("ponzi", "\\b(mlm|multi[\\s-]?level|ponzi|pyramid)\\b", 20)
                )),
                aux(HINDI, List.of(
                        of("khata-band", "(खाता|अकाउंट).{0,20}(बंद|ब्लॉक)", 16),
                        of("otp-hi", "(ओटीपी|कोड).{0,15}(बताओ|बताइए|भेजो|दीजिए)", 22),
                        of("turant", "(तुरंत|जल्दी|अभी)", 10),
                        of("police-hi", "(पुलिस|गिरफ्तार|जेल|कानूनी\\s*कार्रवाई)", 16),
                        of("paise-bhejo", "(पैसे|रुपये|राशि).{0,15}(भेजो|भेजिए|जमा)", 16)
                )),
                aux(HINGLISH, List.of(
                        of("jaldi", "\\b(jaldi|turant|fauran|fatafat)\\b", 12),
                        of("otp-batao", "\\b(otp|code)\\s*(batao|bhejo|do|dijiye|bataiye)\\b", 22),
                        of("paisa-bhejo", "\\b(paisa|paise|rupaye)\\s*(bhejo|transfer\\s*karo|jama\\s*karo)\\b", 14),
                        of("khata-band", "\\b(khata\\s*(band|block)|sim\\s*band|band\\s*ho\\s*jayega)\\b", 14),
                        of("giraftaar", "\\b(giraftaar\\w*|hathkadi|jail\\s*bhej\\w*|kaarwahi|mukadma)\\b", 18),
                        of("adhikari", "\\b(sarkari|adhikari|thana)\\b", 12)
                ))
        );
    }

    private static SignalLayer core(String id, List<SignalRule> rules) {
        return new SignalLayer(id, true, rules);
    }

    private static SignalLayer aux(String id, List<SignalRule> rules) {
        return new SignalLayer(id, false, rules);
    }
}
