package org.smileyface.pageextractor.config;

import org.junit.jupiter.api.Test;
import org.smileyface.pageextractor.engine.CookiePolicy;
import org.smileyface.pageextractor.engine.EngineSettings;
import org.smileyface.pageextractor.engine.JsoupRenderEngine;
import org.smileyface.pageextractor.engine.PlaywrightRenderEngine;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ExtractorPropertiesTest {

    @Test
    void defaults() {
        ExtractorProperties props = new ExtractorProperties();

        assertThat(props.getTimeoutMs()).isEqualTo(30000);
        assertThat(props.getSettleDelayMs()).isEqualTo(2000);
        assertThat(props.getApiKey()).isEmpty();
        assertThat(props.isJavascriptEnabled()).isTrue();
        assertThat(props.isAutoLoadImages()).isFalse();
        assertThat(props.isPluginsEnabled()).isFalse();
        assertThat(props.getEngine().getType()).isEqualTo("playwright");
        assertThat(props.getEngine().isHeadless()).isTrue();
    }

    @Test
    void invalidValues_fallBackToSaneOnes() {
        ExtractorProperties props = new ExtractorProperties();
        props.setTimeoutMs(0);
        props.setSettleDelayMs(-5);
        props.setUserAgent("   ");
        props.setApiKey(null);
        props.getEngine().setType(" JSOUP ");

        assertThat(props.getTimeoutMs()).isEqualTo(30000);
        assertThat(props.getSettleDelayMs()).isZero();
        assertThat(props.getUserAgent()).isNull();
        assertThat(props.getApiKey()).isEmpty();
        assertThat(props.getEngine().getType()).isEqualTo("jsoup");
    }

    @Test
    void cookiesPersistOnlyWithStoragePath() {
        ExtractorProperties props = new ExtractorProperties();
        props.setPersistCookies(true);
        assertThat(props.toEngineSettings().cookiePolicy()).isEqualTo(CookiePolicy.NO_PERSISTENT);

        props.setStoragePath("/tmp/extractor-profile");
        EngineSettings settings = props.toEngineSettings();
        assertThat(settings.cookiePolicy()).isEqualTo(CookiePolicy.FORCE_PERSISTENT);
        assertThat(settings.persistentCookies()).isTrue();
    }

    @Test
    void engineSettings_carryTimeoutAndUserAgent() {
        ExtractorProperties props = new ExtractorProperties();
        props.setTimeoutMs(1234);
        props.setUserAgent("Bot/2");

        EngineSettings settings = props.toEngineSettings();

        assertThat(settings.navigationTimeout()).isEqualTo(Duration.ofMillis(1234));
        assertThat(settings.userAgent()).isEqualTo("Bot/2");
    }

    @Test
    void beanConfig_selectsEngineByType() {
        BeanConfig config = new BeanConfig();
        ExtractorProperties props = new ExtractorProperties();

        props.getEngine().setType("jsoup");
        assertThat(config.renderEngine(props)).isInstanceOf(JsoupRenderEngine.class);

        props.getEngine().setType("playwright");
        assertThat(config.renderEngine(props)).isInstanceOf(PlaywrightRenderEngine.class);

        props.getEngine().setType("netscape");
        assertThat(config.renderEngine(props)).isInstanceOf(PlaywrightRenderEngine.class);
    }
}
