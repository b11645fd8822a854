package com.example.memegen_backend.service;

import com.example.memegen_backend.dto.GateDecision;
import com.example.memegen_backend.dto.Redirect;
import com.example.memegen_backend.dto.RenderRequest;
import com.example.memegen_backend.dto.Rewrite;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CanonicalizationGateTest {

    @Mock
    private AttributionService attribution;

    private CanonicalizationGate gate;

    @BeforeEach
    void setUp() {
        gate = new CanonicalizationGate(attribution);
    }

    @Test
    void templateRouteRedirectsAnimatedStyleToGif() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("style", "animated");
        params.put("width", "300");

        Optional<Redirect> redirect = gate.checkTemplateRoute(request("fry", "", "png", params, null));

        assertThat(redirect).isPresent();
        assertThat(redirect.get().status()).isEqualTo(301);
        assertThat(redirect.get().location()).isEqualTo("/images/fry.gif?width=300");
    }

    @Test
    void templateRouteWithoutAnimatedStyleProceeds() {
        assertThat(gate.checkTemplateRoute(request("fry", "", "png", Map.of("style", "dark"), null))).isEmpty();
        assertThat(gate.checkTemplateRoute(request("fry", "", "gif", Map.of("style", "animated"), null))).isEmpty();
        verifyNoInteractions(attribution);
    }

    @Test
    void animatedStyleWinsOverEveryOtherCheck() {
        GateDecision decision = gate.checkTextRoute(
                request("fry", "hello-world", "jpg", Map.of("style", "animated", "watermark", "x"), "http://h/x"));

        assertThat(decision.redirect()).isNotNull();
        assertThat(decision.redirect().status()).isEqualTo(301);
        assertThat(decision.redirect().location()).isEqualTo("/images/fry/hello-world.gif?watermark=x");
        verifyNoInteractions(attribution);
    }

    @Test
    void nonCanonicalSlugRedirectsPermanentlyKeepingParams() {
        GateDecision decision = gate.checkTextRoute(
                request("fry", "hello-world", "png", Map.of("width", "200"), "http://h/x"));

        assertThat(decision.redirect().status()).isEqualTo(301);
        assertThat(decision.redirect().location()).isEqualTo("/images/fry/hello_world.png?width=200");
        verify(attribution, never()).tokenize(anyString(), any());
    }

    @Test
    void tokenizedUrlRedirectsTemporarily() {
        String url = "http://localhost/images/fry/a.png?api_key=k";
        when(attribution.tokenize(url, "k")).thenReturn(new Rewrite("http://localhost/images/fry/a.png", true));
        RenderRequest request = new RenderRequest("fry", "a", "png", Map.of("api_key", "k"), url, "k", null);

        GateDecision decision = gate.checkTextRoute(request);

        assertThat(decision.redirect().status()).isEqualTo(302);
        assertThat(decision.redirect().location()).isEqualTo("http://localhost/images/fry/a.png");
        verify(attribution, never()).resolveWatermark(any());
    }

    @Test
    void redundantWatermarkRedirectsWithoutIt() {
        String url = "http://localhost/images/fry/a.png?watermark=Memegen.link&width=100";
        Map<String, String> params = new LinkedHashMap<>();
        params.put("watermark", "Memegen.link");
        params.put("width", "100");
        RenderRequest request = new RenderRequest("fry", "a", "png", params, url, null, null);
        when(attribution.tokenize(url, null)).thenReturn(Rewrite.unchanged(url));
        when(attribution.resolveWatermark(request)).thenReturn(new Rewrite("Memegen.link", true));

        GateDecision decision = gate.checkTextRoute(request);

        assertThat(decision.redirect().status()).isEqualTo(302);
        assertThat(decision.redirect().location()).isEqualTo("/images/fry/a.png?width=100");
    }

    @Test
    void canonicalRequestProceedsWithWatermark() {
        String url = "http://localhost/images/fry/top/bottom.png";
        RenderRequest request = new RenderRequest("fry", "top/bottom", "png", Map.of(), url, null, null);
        when(attribution.tokenize(url, null)).thenReturn(Rewrite.unchanged(url));
        when(attribution.resolveWatermark(request)).thenReturn(Rewrite.unchanged("Memegen.link"));

        GateDecision decision = gate.checkTextRoute(request);

        assertThat(decision.redirect()).isNull();
        assertThat(decision.watermark()).isEqualTo("Memegen.link");
    }

    @Test
    void missingUrlSkipsTokenization() {
        RenderRequest request = request("fry", "a", "png", Map.of(), null);
        when(attribution.resolveWatermark(request)).thenReturn(Rewrite.unchanged(""));

        GateDecision decision = gate.checkTextRoute(request);

        assertThat(decision.redirectOpt()).isEmpty();
        verify(attribution, never()).tokenize(any(), any());
    }

    @Test
    void pathHelpersBuildImageRoutes() {
        assertThat(CanonicalizationGate.templatePath("fry", "png")).isEqualTo("/images/fry.png");
        assertThat(CanonicalizationGate.textPath("fry", "a/b", "gif")).isEqualTo("/images/fry/a/b.gif");
    }

    private static RenderRequest request(String id, String slug, String ext, Map<String, String> params, String url) {
        return new RenderRequest(id, slug, ext, params, url, null, null);
    }
}
