package com.example.curator.rag;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.curator.rag.dao.MatchDocumentsDao;
import com.example.curator.rag.dao.SettingsDao;
import com.example.curator.rag.provider.ModelProviderRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class CuratorRagApplicationTests {

    @MockBean
    SettingsDao settingsDao;

    @MockBean
    MatchDocumentsDao matchDocumentsDao;

    @Autowired
    ModelProviderRegistry registry;

  @Test
  void contextLoads() {
    assertThat(registry.configuredProviders()).isEmpty();
  }

}
