package com.example.curator.rag.model;

import java.util.Optional;

/**
 * Topical partitions of the indexed documents. The id is the doc_type the documents were tagged with.
 * Adding a member also needs documents populated under that doc_type.
 */
public enum KnowledgeBase {
    FHIR("fhir", "FHIR specifications, interoperability, health data exchange"),
    VBC("vbc", "Value-based care, quality measures, ACOs, MIPS, population health"),
    GRANTS("grants", "Grant programs, funding opportunities, application guidance"),
    BILLING("billing", "Medical billing, CPT/ICD coding, revenue cycle, reimbursement"),
    IT_SECURITY("it_security", "Healthcare IT, HIPAA, cybersecurity, EHR systems"),
    OPERATIONS("operations", "Rural healthcare operations, CAH, RHC, workforce, telemedicine"),
    COMPLIANCE("compliance", "Regulations, CMS requirements, licensing, legal compliance");

    private final String id;
    private final String description;

    KnowledgeBase(String id, String description) {
        this.id = id;
        this.description = description;
    }

    public String id() {
        return id;
    }

    public String description() {
        return description;
    }

    public static Optional<KnowledgeBase> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (KnowledgeBase kb : values()) {
            if (kb.id.equals(id)) {
                return Optional.of(kb);
            }
        }
        return Optional.empty();
    }
}
