package app.lexrecall.core.card.domain;

import app.lexrecall.core.common.error.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Closed topic catalogue. Every topic belongs to exactly one {@link Subject}; topic codes are only
 * unique within their subject, so lookups always go through {@link #fromCode(Subject, String)}.
 */
public enum Topic {
    // contracts
    CONTRACTS_FORMATION(Subject.CONTRACTS, "formation"),
    CONTRACTS_CONSIDERATION(Subject.CONTRACTS, "consideration"),
    CONTRACTS_STATUTE_OF_FRAUDS(Subject.CONTRACTS, "statute_of_frauds"),
    CONTRACTS_PAROL_EVIDENCE(Subject.CONTRACTS, "parol_evidence"),
    CONTRACTS_CONDITIONS(Subject.CONTRACTS, "conditions"),
    CONTRACTS_BREACH_REMEDIES(Subject.CONTRACTS, "breach_remedies"),
    CONTRACTS_THIRD_PARTY_RIGHTS(Subject.CONTRACTS, "third_party_rights"),
    CONTRACTS_UCC_ARTICLE_2(Subject.CONTRACTS, "ucc_article_2"),
    CONTRACTS_GENERAL(Subject.CONTRACTS, "general"),

    // torts
    TORTS_INTENTIONAL_TORTS(Subject.TORTS, "intentional_torts"),
    TORTS_NEGLIGENCE(Subject.TORTS, "negligence"),
    TORTS_STRICT_LIABILITY(Subject.TORTS, "strict_liability"),
    TORTS_PRODUCTS_LIABILITY(Subject.TORTS, "products_liability"),
    TORTS_DEFAMATION(Subject.TORTS, "defamation"),
    TORTS_PRIVACY(Subject.TORTS, "privacy"),
    TORTS_NUISANCE(Subject.TORTS, "nuisance"),
    TORTS_GENERAL(Subject.TORTS, "general"),

    // constitutional law
    CONLAW_COMMERCE_CLAUSE(Subject.CONSTITUTIONAL_LAW, "commerce_clause"),
    CONLAW_TAXING_SPENDING_POWER(Subject.CONSTITUTIONAL_LAW, "taxing_spending_power"),
    CONLAW_SUPREMACY_CLAUSE(Subject.CONSTITUTIONAL_LAW, "supremacy_clause"),
    CONLAW_DORMANT_COMMERCE(Subject.CONSTITUTIONAL_LAW, "dormant_commerce"),
    CONLAW_PREEMPTION(Subject.CONSTITUTIONAL_LAW, "preemption"),
    CONLAW_EXECUTIVE_POWER(Subject.CONSTITUTIONAL_LAW, "executive_power"),
    CONLAW_FREE_SPEECH_GENERAL(Subject.CONSTITUTIONAL_LAW, "free_speech_general"),
    CONLAW_PUBLIC_FORUM(Subject.CONSTITUTIONAL_LAW, "public_forum"),
    CONLAW_ESTABLISHMENT_CLAUSE(Subject.CONSTITUTIONAL_LAW, "establishment_clause"),
    CONLAW_FREE_EXERCISE(Subject.CONSTITUTIONAL_LAW, "free_exercise"),
    CONLAW_DUE_PROCESS_PROCEDURAL(Subject.CONSTITUTIONAL_LAW, "due_process_procedural"),
    CONLAW_DUE_PROCESS_SUBSTANTIVE(Subject.CONSTITUTIONAL_LAW, "due_process_substantive"),
    CONLAW_EQUAL_PROTECTION(Subject.CONSTITUTIONAL_LAW, "equal_protection"),
    CONLAW_TAKINGS(Subject.CONSTITUTIONAL_LAW, "takings"),
    CONLAW_STATE_ACTION(Subject.CONSTITUTIONAL_LAW, "state_action"),
    CONLAW_STANDING(Subject.CONSTITUTIONAL_LAW, "standing"),
    CONLAW_GENERAL(Subject.CONSTITUTIONAL_LAW, "general"),

    // criminal law
    CRIMLAW_HOMICIDE(Subject.CRIMINAL_LAW, "homicide"),
    CRIMLAW_INCHOATE_CRIMES(Subject.CRIMINAL_LAW, "inchoate_crimes"),
    CRIMLAW_ACCOMPLICE_LIABILITY(Subject.CRIMINAL_LAW, "accomplice_liability"),
    CRIMLAW_DEFENSES(Subject.CRIMINAL_LAW, "defenses"),
    CRIMLAW_PROPERTY_CRIMES(Subject.CRIMINAL_LAW, "property_crimes"),
    CRIMLAW_GENERAL(Subject.CRIMINAL_LAW, "general"),

    // criminal procedure
    CRIMPRO_FOURTH_AMENDMENT(Subject.CRIMINAL_PROCEDURE, "fourth_amendment"),
    CRIMPRO_WARRANT_EXCEPTIONS(Subject.CRIMINAL_PROCEDURE, "warrant_exceptions"),
    CRIMPRO_FIFTH_AMENDMENT_MIRANDA(Subject.CRIMINAL_PROCEDURE, "fifth_amendment_miranda"),
    CRIMPRO_SIXTH_AMENDMENT_COUNSEL(Subject.CRIMINAL_PROCEDURE, "sixth_amendment_counsel"),
    CRIMPRO_EXCLUSIONARY_RULE(Subject.CRIMINAL_PROCEDURE, "exclusionary_rule"),
    CRIMPRO_GENERAL(Subject.CRIMINAL_PROCEDURE, "general"),

    // civil procedure
    CIVPRO_SUBJECT_MATTER_JURISDICTION(Subject.CIVIL_PROCEDURE, "subject_matter_jurisdiction"),
    CIVPRO_PERSONAL_JURISDICTION(Subject.CIVIL_PROCEDURE, "personal_jurisdiction"),
    CIVPRO_VENUE(Subject.CIVIL_PROCEDURE, "venue"),
    CIVPRO_ERIE_DOCTRINE(Subject.CIVIL_PROCEDURE, "erie_doctrine"),
    CIVPRO_PLEADINGS(Subject.CIVIL_PROCEDURE, "pleadings"),
    CIVPRO_JOINDER(Subject.CIVIL_PROCEDURE, "joinder"),
    CIVPRO_DISCOVERY(Subject.CIVIL_PROCEDURE, "discovery"),
    CIVPRO_PRECLUSION(Subject.CIVIL_PROCEDURE, "preclusion"),
    CIVPRO_GENERAL(Subject.CIVIL_PROCEDURE, "general"),

    // evidence
    EVIDENCE_RELEVANCE_GENERAL(Subject.EVIDENCE, "relevance_general"),
    EVIDENCE_LEGAL_RELEVANCE_403(Subject.EVIDENCE, "legal_relevance_403"),
    EVIDENCE_CHARACTER_EVIDENCE(Subject.EVIDENCE, "character_evidence"),
    EVIDENCE_PRIOR_CRIMES_404B(Subject.EVIDENCE, "prior_crimes_404b"),
    EVIDENCE_HABIT_ROUTINE(Subject.EVIDENCE, "habit_routine"),
    EVIDENCE_HEARSAY_DEFINITION(Subject.EVIDENCE, "hearsay_definition"),
    EVIDENCE_PRESENT_SENSE_IMPRESSION(Subject.EVIDENCE, "present_sense_impression"),
    EVIDENCE_EXCITED_UTTERANCE(Subject.EVIDENCE, "excited_utterance"),
    EVIDENCE_BUSINESS_RECORDS(Subject.EVIDENCE, "business_records"),
    EVIDENCE_DYING_DECLARATION(Subject.EVIDENCE, "dying_declaration"),
    EVIDENCE_ADMISSION_PARTY_OPPONENT(Subject.EVIDENCE, "admission_party_opponent"),
    EVIDENCE_ATTORNEY_CLIENT(Subject.EVIDENCE, "attorney_client"),
    EVIDENCE_SPOUSAL_PRIVILEGE(Subject.EVIDENCE, "spousal_privilege"),
    EVIDENCE_IMPEACHMENT_GENERAL(Subject.EVIDENCE, "impeachment_general"),
    EVIDENCE_EXPERT_OPINION(Subject.EVIDENCE, "expert_opinion"),
    EVIDENCE_AUTHENTICATION_GENERAL(Subject.EVIDENCE, "authentication_general"),
    EVIDENCE_ORIGINAL_DOCUMENT(Subject.EVIDENCE, "original_document"),
    EVIDENCE_JUDICIAL_NOTICE_GENERAL(Subject.EVIDENCE, "judicial_notice_general"),
    EVIDENCE_GENERAL(Subject.EVIDENCE, "general"),

    // real property
    PROPERTY_ESTATES_FUTURE_INTERESTS(Subject.REAL_PROPERTY, "estates_future_interests"),
    PROPERTY_CONCURRENT_OWNERSHIP(Subject.REAL_PROPERTY, "concurrent_ownership"),
    PROPERTY_LANDLORD_TENANT(Subject.REAL_PROPERTY, "landlord_tenant"),
    PROPERTY_EASEMENTS(Subject.REAL_PROPERTY, "easements"),
    PROPERTY_COVENANTS(Subject.REAL_PROPERTY, "covenants"),
    PROPERTY_RECORDING_ACTS(Subject.REAL_PROPERTY, "recording_acts"),
    PROPERTY_MORTGAGES(Subject.REAL_PROPERTY, "mortgages"),
    PROPERTY_ADVERSE_POSSESSION(Subject.REAL_PROPERTY, "adverse_possession"),
    PROPERTY_GENERAL(Subject.REAL_PROPERTY, "general"),

    // professional responsibility
    ETHICS_CONFLICTS_OF_INTEREST(Subject.PROFESSIONAL_RESPONSIBILITY, "conflicts_of_interest"),
    ETHICS_CONFIDENTIALITY(Subject.PROFESSIONAL_RESPONSIBILITY, "confidentiality"),
    ETHICS_CLIENT_FUNDS(Subject.PROFESSIONAL_RESPONSIBILITY, "client_funds"),
    ETHICS_ADVERTISING(Subject.PROFESSIONAL_RESPONSIBILITY, "advertising"),
    ETHICS_GENERAL(Subject.PROFESSIONAL_RESPONSIBILITY, "general"),

    // corporations
    CORPORATIONS_FORMATION(Subject.CORPORATIONS, "formation"),
    CORPORATIONS_FIDUCIARY_DUTIES(Subject.CORPORATIONS, "fiduciary_duties"),
    CORPORATIONS_SHAREHOLDER_RIGHTS(Subject.CORPORATIONS, "shareholder_rights"),
    CORPORATIONS_PIERCING_VEIL(Subject.CORPORATIONS, "piercing_veil"),
    CORPORATIONS_PARTNERSHIPS(Subject.CORPORATIONS, "partnerships"),
    CORPORATIONS_GENERAL(Subject.CORPORATIONS, "general"),

    // wills trusts estates
    WILLS_WILL_EXECUTION(Subject.WILLS_TRUSTS_ESTATES, "will_execution"),
    WILLS_INTESTACY(Subject.WILLS_TRUSTS_ESTATES, "intestacy"),
    WILLS_WILL_CONTESTS(Subject.WILLS_TRUSTS_ESTATES, "will_contests"),
    WILLS_TRUST_CREATION(Subject.WILLS_TRUSTS_ESTATES, "trust_creation"),
    WILLS_TRUST_ADMINISTRATION(Subject.WILLS_TRUSTS_ESTATES, "trust_administration"),
    WILLS_GENERAL(Subject.WILLS_TRUSTS_ESTATES, "general"),

    // family law
    FAMILY_MARRIAGE(Subject.FAMILY_LAW, "marriage"),
    FAMILY_DIVORCE(Subject.FAMILY_LAW, "divorce"),
    FAMILY_PROPERTY_DIVISION(Subject.FAMILY_LAW, "property_division"),
    FAMILY_CUSTODY(Subject.FAMILY_LAW, "custody"),
    FAMILY_SUPPORT(Subject.FAMILY_LAW, "support"),
    FAMILY_GENERAL(Subject.FAMILY_LAW, "general"),

    // secured transactions
    SECURED_ATTACHMENT(Subject.SECURED_TRANSACTIONS, "attachment"),
    SECURED_PERFECTION(Subject.SECURED_TRANSACTIONS, "perfection"),
    SECURED_PRIORITY(Subject.SECURED_TRANSACTIONS, "priority"),
    SECURED_DEFAULT_REMEDIES(Subject.SECURED_TRANSACTIONS, "default_remedies"),
    SECURED_GENERAL(Subject.SECURED_TRANSACTIONS, "general"),

    // iowa procedure
    IOWA_IOWA_RULES_CIVIL(Subject.IOWA_PROCEDURE, "iowa_rules_civil"),
    IOWA_IOWA_APPELLATE(Subject.IOWA_PROCEDURE, "iowa_appellate"),
    IOWA_IOWA_JURISDICTION(Subject.IOWA_PROCEDURE, "iowa_jurisdiction"),
    IOWA_GENERAL(Subject.IOWA_PROCEDURE, "general");

    private final Subject subject;
    private final String code;

    Topic(Subject subject, String code) {
        this.subject = subject;
        this.code = code;
    }

    public Subject subject() {
        return subject;
    }

    public String code() {
        return code;
    }

    public static List<Topic> forSubject(Subject subject) {
        List<Topic> out = new ArrayList<>();
        for (Topic t : values()) {
            if (t.subject == subject) out.add(t);
        }
        return out;
    }

    public static Topic fromCode(Subject subject, String value) {
        if (subject == null) {
            throw new ValidationException("subject", "Subject is required");
        }
        if (value == null || value.isBlank()) {
            throw new ValidationException("topic", "Topic is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Topic t : values()) {
            if (t.subject != subject) continue;
            if (t.code.equals(normalized) || t.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return t;
            }
        }
        throw new ValidationException("topic", "Unknown topic '" + value + "' for subject " + subject.code());
    }
}
