package com.example.embeddingindex;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "spring.datasource.url=jdbc:h2:mem:item-api-test;DB_CLOSE_DELAY=-1")
@AutoConfigureMockMvc
public class ItemControllerTest {

    @TempDir
    static Path objects;

    @DynamicPropertySource
    static void storage(DynamicPropertyRegistry registry) {
        registry.add("embeddingindex.storage.local-root", () -> objects.toAbsolutePath().toString());
    }

    @Autowired
    MockMvc mvc;

    @Autowired
    ObjectMapper mapper;

    private static MockMultipartFile png(String name) {
        return new MockMultipartFile("file", name, "image/png", new byte[]{(byte) 0x89, 'P', 'N', 'G', 1, 2});
    }

    @Test
    public void uploadListSearchRedirectDelete() throws Exception {
        String body = mvc.perform(multipart("/api/projects/gallery/items").file(png("cat.png")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.project_id").value("gallery"))
                .andExpect(jsonPath("$.content_type").value("image/png"))
                .andExpect(jsonPath("$.original_filename").value("cat.png"))
                .andExpect(jsonPath("$.size_bytes").value(6))
                .andReturn().getResponse().getContentAsString();
        JsonNode uploaded = mapper.readTree(body);
        String itemId = uploaded.get("item_id").asText();
        assertThat(itemId).isNotBlank();

        mvc.perform(get("/api/projects/gallery/items"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].item_id").value(itemId));

        mvc.perform(get("/api/projects/gallery/items/" + itemId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.item_id").value(itemId));

        mvc.perform(post("/api/projects/gallery/items/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"a cat\",\"limit\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].item.item_id").value(itemId))
                .andExpect(jsonPath("$.results[0].similarity").isNumber());

        mvc.perform(get("/api/projects/gallery/items/" + itemId + "/file"))
                .andExpect(status().isTemporaryRedirect())
                .andExpect(header().string("Location", startsWith("file:")));

        mvc.perform(delete("/api/projects/gallery/items/" + itemId))
                .andExpect(status().isNoContent());
        mvc.perform(get("/api/projects/gallery/items/" + itemId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("ITEM_NOT_FOUND"));
        mvc.perform(delete("/api/projects/gallery/items/" + itemId))
                .andExpect(status().isNotFound());
    }

    @Test
    public void rejectsBadUploads() throws Exception {
        mvc.perform(multipart("/api/projects/gallery/items")
                        .file(new MockMultipartFile("file", "notes.txt", "text/plain", "hello".getBytes())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("UNSUPPORTED_MEDIA_TYPE"));

        mvc.perform(multipart("/api/projects/gallery/items")
                        .file(new MockMultipartFile("file", "empty.png", "image/png", new byte[0])))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("EMPTY_FILE"));

        mvc.perform(multipart("/api/projects/bad$id/items").file(png("x.png")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_PROJECT"));

        mvc.perform(multipart("/api/projects/gallery/items"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void unknownProjectsAndBadSearchesAreReported() throws Exception {
        mvc.perform(get("/api/projects/never-seen/items"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("PROJECT_NOT_FOUND"));

        mvc.perform(post("/api/projects/never-seen/items/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"dog\"}"))
                .andExpect(status().isNotFound());

        mvc.perform(post("/api/projects/gallery/items/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"dog\",\"limit\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_LIMIT"));

        mvc.perform(post("/api/projects/gallery/items/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));
    }
}
