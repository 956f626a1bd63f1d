package com.example.curator.rag.response;

import com.example.curator.rag.model.KnowledgeBase;

public record KnowledgeBaseResponse(String id, String description) {

    public static KnowledgeBaseResponse from(KnowledgeBase kb) {
        return new KnowledgeBaseResponse(kb.id(), kb.description());
    }
}
