package com.deepsearch.research.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VectorStoreRepositoryTest {

    @Test
    @DisplayName("벡터를 pgvector 텍스트 형식으로 기록한다")
    void writesLiteral() {
        assertThat(VectorStoreRepository.toVectorLiteral(new float[]{0.5f, -1.0f, 2.25f})).isEqualTo("[0.5,-1.0,2.25]");
        assertThat(VectorStoreRepository.toVectorLiteral(new float[0])).isEqualTo("[]");
    }

    @Test
    @DisplayName("pgvector 텍스트 형식을 float 배열로 다시 읽는다")
    void parsesLiteral() {
        assertThat(VectorStoreRepository.parseVector("[0.5, -1,2.25]")).containsExactly(0.5f, -1f, 2.25f);
        assertThat(VectorStoreRepository.parseVector("[]")).isEmpty();
        assertThat(VectorStoreRepository.parseVector(null)).isEmpty();
    }
}
