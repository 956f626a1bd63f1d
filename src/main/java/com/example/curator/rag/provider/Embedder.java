package com.example.curator.rag.provider;

import com.example.curator.rag.model.AiProvider;
import com.example.curator.rag.model.QueryEmbedding;

public interface Embedder {

    AiProvider provider();

    QueryEmbedding embed(String text);
}
