package ai.freetranslator.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.freetranslator.http.StubTransport;
import java.net.URI;
import org.junit.jupiter.api.Test;

class LandingPageSeedSourceTest {

    private static final URI LANDING_PAGE = URI.create("https://translate.google.com/");

    @Test
    void readsLiteralSeed() {
        String page = "<script>window.ui={};campaign_tracker_id:'1h',tkk:'445678.1618007056',enable_formality:false</script>";

        assertThat(LandingPageSeedSource.extract(page)).contains(new TokenSeed(445678L, 1618007056L));
    }

    @Test
    void readsAssignedSeedWithDoubleQuotes() {
        assertThat(LandingPageSeedSource.extract("TKK=\"406398.2087938574\";")).contains(TokenSeed.FALLBACK);
    }

    @Test
    void evaluatesObfuscatedSeed() {
        String page = "TKK=eval('((function(){var a\\x3d4264492758;var b\\x3d-1857761911;return 406375+\\x27.\\x27+(a+b)})())');";

        assertThat(LandingPageSeedSource.extract(page)).contains(new TokenSeed(406375L, 4264492758L - 1857761911L));
    }

    @Test
    void reportsPageWithoutSeed() {
        assertThat(LandingPageSeedSource.extract("<html><body>nothing here</body></html>")).isEmpty();
        assertThat(LandingPageSeedSource.extract("")).isEmpty();
    }

    @Test
    void fetchDownloadsLandingPage() {
        StubTransport transport = new StubTransport()
                .reply(StubTransport.LANDING_PAGE, StubTransport.ok("x;tkk:'1.2';y"));

        TokenSeed seed = new LandingPageSeedSource(transport, LANDING_PAGE).fetch();

        assertThat(seed).isEqualTo(new TokenSeed(1L, 2L));
        assertThat(transport.lastHeaders(StubTransport.LANDING_PAGE)).containsKey("User-Agent");
    }

    @Test
    void fetchFailsWhenSeedMissing() {
        StubTransport transport = new StubTransport()
                .reply(StubTransport.LANDING_PAGE, StubTransport.ok("<html></html>"));

        assertThatThrownBy(() -> new LandingPageSeedSource(transport, LANDING_PAGE).fetch())
                .isInstanceOf(SeedFormatException.class)
                .hasMessageContaining("translate.google.com");
    }

    @Test
    void oversizedSeedIsFormatError() {
        assertThatThrownBy(() -> LandingPageSeedSource.extract("tkk:'99999999999999999999.1'"))
                .isInstanceOf(SeedFormatException.class)
                .hasCauseInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> LandingPageSeedSource.extract(
                "var a\\x3d9223372036854775807;var b\\x3d1;return 406375+"))
                .isInstanceOf(SeedFormatException.class);
    }

    @Test
    void generatorFallsBackWhenPageSeedOverflows() {
        StubTransport transport = new StubTransport()
                .reply(StubTransport.LANDING_PAGE, StubTransport.ok("x;tkk:'99999999999999999999.1';y"));
        TokenGenerator generator = new TokenGenerator(new LandingPageSeedSource(transport, LANDING_PAGE));

        String token = generator.generate("hello");

        assertThat(token).isEqualTo("338590.203232");
        assertThat(generator.isSeedObsolete()).isTrue();
    }

    @Test
    void parsesDottedSeed() {
        assertThat(TokenSeed.parse(" 406398.2087938574 ")).isEqualTo(TokenSeed.FALLBACK);
        assertThatThrownBy(() -> TokenSeed.parse("406398"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
