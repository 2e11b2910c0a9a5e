package dev.jobharvest;

import dev.jobharvest.ai.ExtractionOracle;
import dev.jobharvest.ats.AtsParserRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

    @MockitoBean
    private PipelineRunner pipelineRunner;

    @MockitoBean
    private ExitManager exitManager;

    @Autowired
    private ExtractionOracle extractionOracle;

    @Autowired
    private AtsParserRegistry atsParserRegistry;

    @Test
    void contextLoads() {
        assertThat(extractionOracle.getName()).isEqualTo("openrouter");
        assertThat(atsParserRegistry.getParsers()).hasSize(3);
    }
}
