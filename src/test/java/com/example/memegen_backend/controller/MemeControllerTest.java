package com.example.memegen_backend.controller;

import com.example.memegen_backend.dto.AutomaticMemeRequest;
import com.example.memegen_backend.dto.AutomaticMemeResponse;
import com.example.memegen_backend.dto.CustomMemeRequest;
import com.example.memegen_backend.dto.ExampleResponse;
import com.example.memegen_backend.dto.MemeCreateRequest;
import com.example.memegen_backend.dto.MemeUrlResponse;
import com.example.memegen_backend.dto.RenderRequest;
import com.example.memegen_backend.service.MemeImageService;
import com.example.memegen_backend.service.MemeUrlService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = MemeController.class)
@AutoConfigureMockMvc(addFilters = false)
class MemeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private MemeImageService imageService;

    @MockitoBean
    private MemeUrlService urlService;

    @Test
    void indexListsExamples() throws Exception {
        when(urlService.examples("http://localhost", "fry"))
                .thenReturn(List.of(new ExampleResponse("http://localhost/images/fry/a/b.png", "fry")));

        mockMvc.perform(get("/images").queryParam("filter", "fry"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].url").value("http://localhost/images/fry/a/b.png"))
                .andExpect(jsonPath("$[0].template").value("fry"));
    }

    @Test
    void createReturns201WithUrl() throws Exception {
        when(urlService.create(eq("http://localhost"), any(MemeCreateRequest.class)))
                .thenReturn("http://localhost/images/fry/a/b.png");

        String body = objectMapper.writeValueAsString(Map.of("template_id", "fry", "text_lines", List.of("a", "b")));

        mockMvc.perform(post("/images").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.url").value("http://localhost/images/fry/a/b.png"));

        ArgumentCaptor<MemeCreateRequest> captor = ArgumentCaptor.forClass(MemeCreateRequest.class);
        verify(urlService).create(eq("http://localhost"), captor.capture());
        assertThat(captor.getValue().templateId()).isEqualTo("fry");
        assertThat(captor.getValue().textLines()).containsExactly("a", "b");
    }

    @Test
    void createWithRedirectAnswers302() throws Exception {
        when(urlService.create(eq("http://localhost"), any(MemeCreateRequest.class)))
                .thenReturn("http://localhost/images/fry/a.png?style=dark");

        String body = objectMapper.writeValueAsString(Map.of("template_id", "fry", "redirect", true));

        mockMvc.perform(post("/images").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isFound())
                .andExpect(header().string(HttpHeaders.LOCATION, "http://localhost/images/fry/a.png?style=dark&status=201"));
    }

    @Test
    void customCreateReturns201() throws Exception {
        when(urlService.createCustom(eq("http://localhost"), any(CustomMemeRequest.class)))
                .thenReturn("http://localhost/images/custom/a.png?background=https://x.test/bg.png");

        String body = objectMapper.writeValueAsString(Map.of("background", "https://x.test/bg.png", "text_lines", List.of("a")));

        mockMvc.perform(post("/images/custom").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.url").value("http://localhost/images/custom/a.png?background=https://x.test/bg.png"));
    }

    @Test
    void textImageIsStreamedAsynchronously() throws Exception {
        when(imageService.textImage(any(RenderRequest.class))).thenReturn(CompletableFuture.completedFuture(image(404)));

        MvcResult result = mockMvc.perform(get("/images/fry/top/bottom.png")
                        .queryParam("width", "100")
                        .header("X-API-KEY", "k")
                        .header(HttpHeaders.REFERER, "https://example.com"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isNotFound())
                .andExpect(content().contentType(MediaType.IMAGE_PNG))
                .andExpect(content().bytes(new byte[]{1, 2, 3}));

        ArgumentCaptor<RenderRequest> captor = ArgumentCaptor.forClass(RenderRequest.class);
        verify(imageService).textImage(captor.capture());
        RenderRequest request = captor.getValue();
        assertThat(request.templateId()).isEqualTo("fry");
        assertThat(request.textSlug()).isEqualTo("top/bottom");
        assertThat(request.extension()).isEqualTo("png");
        assertThat(request.params()).containsEntry("width", "100");
        assertThat(request.url()).isEqualTo("http://localhost/images/fry/top/bottom.png?width=100");
        assertThat(request.apiKey()).isEqualTo("k");
        assertThat(request.referer()).isEqualTo("https://example.com");
    }

    @Test
    void apiKeyFallsBackToQueryParam() throws Exception {
        when(imageService.textImage(any(RenderRequest.class))).thenReturn(CompletableFuture.completedFuture(image(200)));

        MvcResult result = mockMvc.perform(get("/images/fry/a.jpg").queryParam("api_key", "q"))
                .andExpect(request().asyncStarted())
                .andReturn();
        mockMvc.perform(asyncDispatch(result)).andExpect(status().isOk());

        ArgumentCaptor<RenderRequest> captor = ArgumentCaptor.forClass(RenderRequest.class);
        verify(imageService).textImage(captor.capture());
        assertThat(captor.getValue().apiKey()).isEqualTo("q");
        assertThat(captor.getValue().extension()).isEqualTo("jpg");
    }

    @Test
    void templateBackgroundRoute() throws Exception {
        when(imageService.templateBackground(any(RenderRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(
                        ResponseEntity.status(301).location(URI.create("/images/fry.gif")).<Resource>build()));

        MvcResult result = mockMvc.perform(get("/images/fry.png").queryParam("style", "animated"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isMovedPermanently())
                .andExpect(header().string(HttpHeaders.LOCATION, "/images/fry.gif"));

        ArgumentCaptor<RenderRequest> captor = ArgumentCaptor.forClass(RenderRequest.class);
        verify(imageService).templateBackground(captor.capture());
        assertThat(captor.getValue().templateId()).isEqualTo("fry");
        assertThat(captor.getValue().textSlug()).isEmpty();
        assertThat(captor.getValue().extension()).isEqualTo("png");
    }

    @Test
    void textRouteWithoutExtensionIs404() throws Exception {
        mockMvc.perform(get("/images/fry/top/bottom"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/images/fry/top.png/bottom"))
                .andExpect(status().isNotFound());

        verifyNoInteractions(imageService);
    }

    private static ResponseEntity<Resource> image(int status) {
        return ResponseEntity.status(status)
                .contentType(MediaType.IMAGE_PNG)
                .body(new ByteArrayResource(new byte[]{1, 2, 3}));
    }

    @Test
    void automaticReturns201WithConfidence() throws Exception {
        when(urlService.automatic(any(AutomaticMemeRequest.class), eq("k")))
                .thenReturn(new AutomaticMemeResponse("http://localhost/images/fry/nope.png", 0.9));

        mockMvc.perform(post("/images/automatic").header("X-API-KEY", "k")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"text\":\"nope\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.url").value("http://localhost/images/fry/nope.png"))
                .andExpect(jsonPath("$.confidence").value(0.9));

        ArgumentCaptor<AutomaticMemeRequest> captor = ArgumentCaptor.forClass(AutomaticMemeRequest.class);
        verify(urlService).automatic(captor.capture(), eq("k"));
        assertThat(captor.getValue().text()).isEqualTo("nope");
    }

    @Test
    void automaticWithRedirectAnswers302() throws Exception {
        when(urlService.automatic(any(AutomaticMemeRequest.class), isNull()))
                .thenReturn(new AutomaticMemeResponse("http://localhost/images/fry/nope.png?token=t", 0.9));

        mockMvc.perform(post("/images/automatic").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"nope\",\"redirect\":true}"))
                .andExpect(status().isFound())
                .andExpect(header().string(HttpHeaders.LOCATION, "http://localhost/images/fry/nope.png?token=t&status=201"));
    }

    @Test
    void automaticWithoutTextIs400() throws Exception {
        when(urlService.automatic(any(AutomaticMemeRequest.class), isNull()))
                .thenThrow(new ResponseStatusException(HttpStatus.BAD_REQUEST, "TEXT_REQUIRED"));

        mockMvc.perform(post("/images/automatic").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void popularCustomListsUrls() throws Exception {
        when(urlService.popularCustom("cats", false, null))
                .thenReturn(List.of(new MemeUrlResponse("http://localhost/images/custom/a.png")));

        mockMvc.perform(get("/images/custom").queryParam("filter", "cats").queryParam("safe", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].url").value("http://localhost/images/custom/a.png"));
        verifyNoInteractions(imageService);
    }

    @Test
    void popularCustomDefaultsToSafeAndAnswers404WhenEmpty() throws Exception {
        when(urlService.popularCustom(null, true, null))
                .thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "No results matched: "));

        mockMvc.perform(get("/images/custom"))
                .andExpect(status().isNotFound());
    }
}
