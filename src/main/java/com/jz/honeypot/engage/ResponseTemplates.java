package com.jz.honeypot.engage;

import com.jz.honeypot.domain.CandidateResponse;
import com.jz.honeypot.domain.Stage;
import com.jz.honeypot.domain.Tactic;
import com.jz.honeypot.domain.Theme;

import java.util.List;

import static com.jz.honeypot.domain.Stage.*;
import static com.jz.honeypot.domain.Theme.*;

/**
 * 预先写好的受害者回复。阶段池按阶段分组；手法池的 stage 是最早解锁的阶段。
 */
final class ResponseTemplates {

    private ResponseTemplates() {
    }

    static final List<CandidateResponse> STAGE = List.of(
            // ---------- CONFUSED ----------
            s("confused-01", CONFUSED, CONFUSION, "Hello? Who is this speaking? I did not understand what you said, please say it again slowly."),
            s("confused-02", CONFUSED, CONFUSION, "Sorry beta, I am a senior citizen and I get confused with these phone matters. Which company are you from?"),
            s("confused-03", CONFUSED, CONFUSION, "What account are you talking about? I have two accounts and I don't understand which one you mean."),
            s("confused-04", CONFUSED, FEAR, "Oh no, is something wrong? I am getting worried now, my blood pressure is already high."),
            s("confused-05", CONFUSED, CONFUSION, "I don't understand these technical words. Can you explain in simple language what has happened?"),
            s("confused-06", CONFUSED, STALLING, "Wait wait, let me find my glasses first. I cannot read anything on this small phone screen."),
            s("confused-07", CONFUSED, CONFUSION, "Arre, who gave you my number? I never gave it to any company."),
            s("confused-08", CONFUSED, CONFUSION, "Is this about my pension? My son handles all these things, I am not very good with banks."),
            s("confused-09", CONFUSED, STALLING, "Hold on, the TV is very loud. Let me go to the other room so I can hear you properly."),
            s("confused-10", CONFUSED, CONFUSION, "Sorry, I am not following. Are you calling from the bank or from some other office?"),
            s("confused-11", CONFUSED, FEAR, "You are scaring me. I have never had any problem like this before, what exactly is happening?"),
            s("confused-12", CONFUSED, CONFUSION, "Ji, I am listening but I did not catch your name. What did you say your name was?"),

            // ---------- VERIFYING ----------
            s("verifying-01", VERIFYING, PROBING, "Before I do anything, tell me your full name and which office you are calling from."),
            s("verifying-02", VERIFYING, PROBING, "How do I know you are really from there? Can you give me some employee ID or reference?"),
            s("verifying-03", VERIFYING, CONFUSION, "My bank never calls me like this. Why are you calling on my mobile instead of sending a letter?"),
            s("verifying-04", VERIFYING, PROBING, "Which branch are you from exactly? I want to note it down in my diary."),
            s("verifying-05", VERIFYING, STALLING, "One minute, let me get a pen and paper. My memory is not so good nowadays."),
            s("verifying-06", VERIFYING, CONFUSION, "I am confused, you said one thing earlier and now something else. Can you explain again from the start?"),
            s("verifying-07", VERIFYING, RED_FLAG, "My grandson told me people call pretending to be from banks. I hope you are not one of those?"),
            s("verifying-08", VERIFYING, PROBING, "Is there a complaint number or case number for this? Please tell me so I can check later."),
            s("verifying-09", VERIFYING, FEAR, "Is my money safe right now? I have my whole life savings in that account."),
            s("verifying-10", VERIFYING, PROBING, "Can you tell me the official helpline number? I will call back to confirm it is you."),
            s("verifying-11", VERIFYING, STALLING, "My phone battery is very low, please speak quickly and clearly. What do you need from me?"),
            s("verifying-12", VERIFYING, CONFUSION, "I did not receive any message about this. Where exactly did you see the problem with my account?"),

            // ---------- SUSPICIOUS ----------
            s("suspicious-01", SUSPICIOUS, RED_FLAG, "This sounds strange to me. Real officers don't ask for such things on the phone, do they?"),
            s("suspicious-02", SUSPICIOUS, PROBING, "If you are genuine, give me your supervisor's name and the landline number of your office."),
            s("suspicious-03", SUSPICIOUS, RED_FLAG, "Why is there so much hurry? Any real matter can wait until I visit the branch tomorrow."),
            s("suspicious-04", SUSPICIOUS, STALLING, "Let me call my son first, he knows about these things. Can you hold for some time?"),
            s("suspicious-05", SUSPICIOUS, PROBING, "What is your employee ID and department? I will verify it with the head office."),
            s("suspicious-06", SUSPICIOUS, FEAR, "I am really nervous now. If I do what you say, will everything be fine?"),
            s("suspicious-07", SUSPICIOUS, RED_FLAG, "I read in the newspaper about such calls. How can I be sure this is not a fraud?"),
            s("suspicious-08", SUSPICIOUS, PROBING, "Send me something in writing on your official email. What is the email address?"),
            s("suspicious-09", SUSPICIOUS, STALLING, "Hold on, someone is at the door. Don't cut the call, I will be back in one minute."),
            s("suspicious-10", SUSPICIOUS, PROBING, "Which city is your office in? Tell me the full address, I may come personally."),
            s("suspicious-11", SUSPICIOUS, RED_FLAG, "Banks always say never share details on phone. Why are you asking me then?"),
            s("suspicious-12", SUSPICIOUS, COMPLIANCE, "Okay, I am listening. But explain properly what will happen after I do this."),

            // ---------- COOPERATIVE ----------
            s("cooperative-01", COOPERATIVE, COMPLIANCE, "Okay, I believe you now. Tell me step by step what I need to do, I will follow."),
            s("cooperative-02", COOPERATIVE, PROBING, "Alright, but give me your direct phone number in case the call drops in between."),
            s("cooperative-03", COOPERATIVE, EXTRACTION, "I am ready to cooperate. Where exactly should the money go? Tell me the full details."),
            s("cooperative-04", COOPERATIVE, STALLING, "My internet is very slow today, the app is still loading. Please wait one moment."),
            s("cooperative-05", COOPERATIVE, COMPLIANCE, "Fine, I understand it is important. I just want to do it correctly the first time."),
            s("cooperative-06", COOPERATIVE, PROBING, "What name will show when I send it? I want to be sure it goes to the right person."),
            s("cooperative-07", COOPERATIVE, EXTRACTION, "Tell me the account details again slowly, I am writing everything in my notebook."),
            s("cooperative-08", COOPERATIVE, STALLING, "Let me find my passbook, it is somewhere in the cupboard. Don't worry, I am checking."),
            s("cooperative-09", COOPERATIVE, COMPLIANCE, "Okay sahab, I trust you. Just guide me, I am not good with these mobile apps."),
            s("cooperative-10", COOPERATIVE, PROBING, "Who should I ask for if I call your office later? Give me the name and extension."),
            s("cooperative-11", COOPERATIVE, EXTRACTION, "Which bank is the receiving account in? My app is asking for the bank name also."),
            s("cooperative-12", COOPERATIVE, FEAR, "Please make sure nothing happens to my pension. I will do whatever you say."),

            // ---------- EXTRACTING ----------
            s("extracting-01", EXTRACTING, EXTRACTION, "The app is asking for beneficiary name and IFSC code. What should I type there?"),
            s("extracting-02", EXTRACTING, EXTRACTION, "It says invalid, maybe I wrote it wrong. Can you tell me the account number once more?"),
            s("extracting-03", EXTRACTING, STALLING, "The screen went blank. Let me restart the phone, please stay on the line."),
            s("extracting-04", EXTRACTING, EXTRACTION, "Should I send it by UPI or bank transfer? Give me whichever details are easier."),
            s("extracting-05", EXTRACTING, COMPLIANCE, "Okay, I am doing it now. Just confirm the amount again so I don't make a mistake."),
            s("extracting-06", EXTRACTING, EXTRACTION, "My son says I need a reference number for the payment. What should I write in the remarks?"),
            s("extracting-07", EXTRACTING, STALLING, "The OTP has not come yet, the network is very bad here. Can you wait two minutes?"),
            s("extracting-08", EXTRACTING, EXTRACTION, "If this transfer fails, is there any other account or UPI ID I can use instead?"),
            s("extracting-09", EXTRACTING, COMPLIANCE, "Alright, almost done. Which number should I call after the payment to confirm?"),
            s("extracting-10", EXTRACTING, EXTRACTION, "Spell the UPI ID letter by letter please, my eyes are weak and I don't want to send it wrong."),
            s("extracting-11", EXTRACTING, STALLING, "Let me check my balance first, I think the pension has not been credited yet."),
            s("extracting-12", EXTRACTING, EXTRACTION, "The bank is asking whose name the account is in. Tell me the full name of the account holder.")
    );

    static final List<CandidateResponse> TACTIC = List.of(
            // ---------- OTP ----------
            t("otp-01", Tactic.OTP, VERIFYING, CONFUSION, "Which OTP are you talking about? I get so many messages, I don't know which one is from the bank."),
            t("otp-02", Tactic.OTP, VERIFYING, RED_FLAG, "The message itself says do not share OTP with anyone. Why do you need it then?"),
            t("otp-03", Tactic.OTP, VERIFYING, STALLING, "Wait, let me open the messages. My phone is old and it takes time to load."),
            t("otp-04", Tactic.OTP, SUSPICIOUS, PROBING, "Which number will the OTP come from? Tell me so I can check it is the real bank."),
            t("otp-05", Tactic.OTP, SUSPICIOUS, FEAR, "If I don't give the OTP, will my account really be blocked? I am very scared."),
            t("otp-06", Tactic.OTP, COOPERATIVE, STALLING, "The OTP came but the screen locked. Let me unlock it, what was your employee ID again?"),
            t("otp-07", Tactic.OTP, COOPERATIVE, EXTRACTION, "Before I read the code, tell me your callback number in case the call disconnects."),
            t("otp-08", Tactic.OTP, VERIFYING, CONFUSION, "Is OTP the same as my ATM PIN? I always get confused between these two."),

            // ---------- ACCOUNT ----------
            t("account-01", Tactic.ACCOUNT, VERIFYING, FEAR, "Why will my account be blocked? I just withdrew money last week, everything was fine."),
            t("account-02", Tactic.ACCOUNT, VERIFYING, PROBING, "Which account number are you seeing on your screen? Tell me the last four digits."),
            t("account-03", Tactic.ACCOUNT, VERIFYING, RED_FLAG, "My bank would send a letter before blocking anything. Why is this only by phone?"),
            t("account-04", Tactic.ACCOUNT, SUSPICIOUS, STALLING, "Let me check my passbook, the last entry will show if something is wrong."),
            t("account-05", Tactic.ACCOUNT, SUSPICIOUS, PROBING, "What is the KYC reference number? I will tell my branch manager to check it."),
            t("account-06", Tactic.ACCOUNT, COOPERATIVE, COMPLIANCE, "Okay, I don't want it blocked. Tell me what to do to keep my account active."),
            t("account-07", Tactic.ACCOUNT, COOPERATIVE, EXTRACTION, "If I need to move my money to a safe account, give me that account's full details."),
            t("account-08", Tactic.ACCOUNT, VERIFYING, CONFUSION, "Is this the savings account or the pension account? I don't understand which one is the problem."),

            // ---------- PAYMENT ----------
            t("payment-01", Tactic.PAYMENT, VERIFYING, CONFUSION, "Why do I have to pay anything? Nobody told me about any payment before."),
            t("payment-02", Tactic.PAYMENT, VERIFYING, RED_FLAG, "Paying a fee first to receive money sounds wrong. My son says that is how frauds work."),
            t("payment-03", Tactic.PAYMENT, SUSPICIOUS, PROBING, "What is this payment for exactly? Give me a receipt number or invoice for my records."),
            t("payment-04", Tactic.PAYMENT, SUSPICIOUS, STALLING, "I have to check how much balance I have. Let me open the app, it is very slow."),
            t("payment-05", Tactic.PAYMENT, COOPERATIVE, EXTRACTION, "Okay, where should I send it? Tell me the UPI ID or account number slowly."),
            t("payment-06", Tactic.PAYMENT, COOPERATIVE, EXTRACTION, "What name should appear when I pay? The app shows the receiver name before sending."),
            t("payment-07", Tactic.PAYMENT, COOPERATIVE, COMPLIANCE, "Alright, I will pay. But I can only do small amounts, is that fine?"),
            t("payment-08", Tactic.PAYMENT, VERIFYING, CONFUSION, "Rupees? So much? I will have to ask my son, I don't keep that much in the account."),

            // ---------- THREAT ----------
            t("threat-01", Tactic.THREAT, VERIFYING, FEAR, "Police? Arrest? I have never done anything wrong in my whole life. Please tell me what happened."),
            t("threat-02", Tactic.THREAT, VERIFYING, RED_FLAG, "Real police send summons on paper. Why is this happening on a phone call?"),
            t("threat-03", Tactic.THREAT, SUSPICIOUS, PROBING, "What is the FIR number and which police station is it registered in?"),
            t("threat-04", Tactic.THREAT, SUSPICIOUS, PROBING, "What is your badge number and name, officer? I want to tell my lawyer."),
            t("threat-05", Tactic.THREAT, VERIFYING, FEAR, "I am shaking now. Please don't send anyone to my house, I will cooperate."),
            t("threat-06", Tactic.THREAT, COOPERATIVE, STALLING, "Let me sit down first, I am feeling dizzy. Give me one minute to take my medicine."),
            t("threat-07", Tactic.THREAT, COOPERATIVE, EXTRACTION, "If I pay the penalty will the case close? Tell me where the fine has to be deposited."),
            t("threat-08", Tactic.THREAT, SUSPICIOUS, RED_FLAG, "Why should I not tell my family? Any honest officer would let me talk to my son."),

            // ---------- TECH ----------
            t("tech-01", Tactic.TECH, VERIFYING, CONFUSION, "Virus? My grandson installed everything on this phone, I don't know what is inside."),
            t("tech-02", Tactic.TECH, VERIFYING, RED_FLAG, "Why should I install an app from a link? My son said only use the Play Store."),
            t("tech-03", Tactic.TECH, SUSPICIOUS, STALLING, "The download is stuck at ten percent. The internet here is very slow, please wait."),
            t("tech-04", Tactic.TECH, SUSPICIOUS, PROBING, "Which company makes this software? Tell me the company name and your employee ID."),
            t("tech-05", Tactic.TECH, VERIFYING, FEAR, "If someone has hacked my phone, can they see my bank app also? I am so worried."),
            t("tech-06", Tactic.TECH, COOPERATIVE, COMPLIANCE, "Okay, the app is opening. It is asking for some code, what should I do now?"),
            t("tech-07", Tactic.TECH, COOPERATIVE, EXTRACTION, "The link is not opening. Can you send it again and also give me a number to call you?"),
            t("tech-08", Tactic.TECH, SUSPICIOUS, RED_FLAG, "Letting a stranger control my phone makes me nervous. Is there no other way?"),

            // ---------- COURIER ----------
            t("courier-01", Tactic.COURIER, VERIFYING, CONFUSION, "Parcel? I have not ordered anything. Who sent this parcel in my name?"),
            t("courier-02", Tactic.COURIER, VERIFYING, PROBING, "What is the tracking number? I will check it on the courier company website."),
            t("courier-03", Tactic.COURIER, SUSPICIOUS, RED_FLAG, "Why would anyone send drugs in my name? This sounds like a scam I heard about on the news."),
            t("courier-04", Tactic.COURIER, SUSPICIOUS, PROBING, "Which customs office is holding it? Give me the address and the officer's name."),
            t("courier-05", Tactic.COURIER, VERIFYING, FEAR, "Will I be arrested because of someone else's parcel? Please help me, I am very scared."),
            t("courier-06", Tactic.COURIER, COOPERATIVE, EXTRACTION, "If I have to pay customs charges, where should I send it? Tell me the account details."),
            t("courier-07", Tactic.COURIER, SUSPICIOUS, STALLING, "Let me find the receipt of my last order, maybe it got mixed up. One minute."),
            t("courier-08", Tactic.COURIER, COOPERATIVE, COMPLIANCE, "Okay, I will clear this matter. Just tell me what documents you need from me."),

            // ---------- IDENTITY ----------
            t("identity-01", Tactic.IDENTITY, VERIFYING, CONFUSION, "Aadhaar number? I kept the card somewhere safe, I don't remember where now."),
            t("identity-02", Tactic.IDENTITY, VERIFYING, RED_FLAG, "Why do you need my Aadhaar and PAN on the phone? I have heard people misuse them."),
            t("identity-03", Tactic.IDENTITY, SUSPICIOUS, PROBING, "Which office will store my documents? Give me the office address and your employee ID."),
            t("identity-04", Tactic.IDENTITY, SUSPICIOUS, STALLING, "Let me search in the almirah for the PAN card. My wife kept all the papers."),
            t("identity-05", Tactic.IDENTITY, COOPERATIVE, EXTRACTION, "Where should I send the photo of the card? Give me the email address or number."),
            t("identity-06", Tactic.IDENTITY, VERIFYING, FEAR, "Has someone misused my Aadhaar? Will I get into trouble because of it?"),
            t("identity-07", Tactic.IDENTITY, COOPERATIVE, COMPLIANCE, "Alright, I will give the details, but first tell me it will stay confidential."),
            t("identity-08", Tactic.IDENTITY, SUSPICIOUS, RED_FLAG, "The government already has my Aadhaar. Why would they call me to ask for it again?"),

            // ---------- URGENCY ----------
            t("urgency-01", Tactic.URGENCY, VERIFYING, STALLING, "Please don't rush me, I am old and I need time to understand. Speak slowly."),
            t("urgency-02", Tactic.URGENCY, VERIFYING, RED_FLAG, "Why so much hurry? Genuine people give time, they don't pressure like this."),
            t("urgency-03", Tactic.URGENCY, SUSPICIOUS, PROBING, "If it is so urgent, give me your office number and I will call back immediately."),
            t("urgency-04", Tactic.URGENCY, VERIFYING, FEAR, "Only few minutes? Oh no, what will happen if I am late? Please tell me."),
            t("urgency-05", Tactic.URGENCY, SUSPICIOUS, STALLING, "Hold on, the app is asking me to update. It will take some time, please wait."),
            t("urgency-06", Tactic.URGENCY, COOPERATIVE, COMPLIANCE, "Okay okay, I am doing it quickly. Just tell me exactly what to do."),
            t("urgency-07", Tactic.URGENCY, COOPERATIVE, EXTRACTION, "Fine, to do it fast give me all the details at once: name, account and amount."),
            t("urgency-08", Tactic.URGENCY, VERIFYING, CONFUSION, "Deadline for what? Nobody told me about any deadline, what is this about?")
    );

    /** 空消息或异常时使用的通用困惑回复 */
    static final List<String> GENERIC_CONFUSED = List.of(
            "Hello? I did not get your message properly. Can you say it again?",
            "Sorry, I could not understand. Who is this and what do you want?",
            "Ji? The message came blank on my phone. Please write again.",
            "I am not able to read this. Can you explain once more slowly?"
    );

    private static CandidateResponse s(String id, Stage stage, Theme theme, String text) {
        return CandidateResponse.builder().id(id).stageAffinity(stage).theme(theme).text(text).build();
    }

    private static CandidateResponse t(String id, Tactic tactic, Stage minStage, Theme theme, String text) {
        return CandidateResponse.builder().id(id).stageAffinity(minStage).tacticAffinity(tactic).theme(theme).text(text).build();
    }
}
