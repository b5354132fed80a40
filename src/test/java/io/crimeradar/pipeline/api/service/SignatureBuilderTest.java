package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.PipelineConfigFixtures;
import io.crimeradar.pipeline.api.dto.MinHashSignature;
import io.crimeradar.pipeline.config.PipelineConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

class SignatureBuilderTest {

    private SignatureBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new SignatureBuilder(PipelineConfigFixtures.dedupConfig());
    }

    @Test
    @DisplayName("Should keep only distinct lowercase tokens of five or more characters")
    void shouldExtractLongTokens() {
        assertThat(builder.shingles("The Police said the SHOOTING near the police station was brief"))
                .containsExactly("police", "shooting", "station", "brief");
    }

    @Test
    @DisplayName("Should treat accented letters as word characters")
    void shouldKeepAccentedTokens() {
        assertThat(builder.shingles("Polícia investiga homicídio em Niterói"))
                .containsExactly("polícia", "investiga", "homicídio", "niterói");
    }

    @Test
    @DisplayName("Should build identical signatures for identical text")
    void shouldBeDeterministic() {
        String text = "Armed robbery reported downtown after midnight, witnesses describe suspects";

        MinHashSignature first = builder.build(text);
        MinHashSignature second = new SignatureBuilder(PipelineConfigFixtures.dedupConfig()).build(text);

        assertThat(first.size()).isEqualTo(128);
        assertThat(first).isEqualTo(second);
        assertThat(first.estimateJaccard(second)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should ignore case, punctuation and token order")
    void shouldDependOnTokenSetOnly() {
        MinHashSignature a = builder.build("Robbery downtown: suspects escaped quickly.");
        MinHashSignature b = builder.build("quickly ESCAPED suspects, downtown robbery");

        assertThat(a).isEqualTo(b);
    }

    @Test
    @DisplayName("Should produce an empty signature when no token is long enough")
    void shouldProduceEmptySignatureForShortTokens() {
        MinHashSignature signature = builder.build("a cat sat on the mat");

        assertThat(signature.isEmpty()).isTrue();
        assertThat(signature.estimateJaccard(signature)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should estimate low similarity for unrelated texts")
    void shouldEstimateLowSimilarityForUnrelatedTexts() {
        MinHashSignature crime = builder.build("gunmen robbed jewellery store downtown yesterday evening police arrested");
        MinHashSignature weather = builder.build("sunny weather expected across coastal regions throughout weekend forecast");

        assertThat(crime.estimateJaccard(weather)).isLessThan(0.1);
    }

    @Test
    @DisplayName("Should be created by Spring from the pipeline configuration")
    void shouldBeCreatedBySpring() {
        try (var context = new AnnotationConfigApplicationContext()) {
            context.registerBean(PipelineConfig.class, PipelineConfigFixtures::pipelineConfig);
            context.register(SignatureBuilder.class);
            context.refresh();

            MinHashSignature signature = context.getBean(SignatureBuilder.class).build("Robbery suspects arrested downtown");

            assertThat(signature.size()).isEqualTo(128);
            assertThat(signature).isEqualTo(builder.build("Robbery suspects arrested downtown"));
        }
    }
}
