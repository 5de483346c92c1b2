package tech.yump.passkeeper.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import tech.yump.passkeeper.auth.token.TokenService;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.is;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.anonymous;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
@ActiveProfiles("test")
class PassKeeperApiIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgresContainer = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("passkeeper")
            .withUsername("testuser")
            .withPassword("testpassword");

    @TempDir
    static Path blobDir;

    @DynamicPropertySource
    static void passKeeperProperties(DynamicPropertyRegistry registry) {
        registry.add("passkeeper.datasource.url", postgresContainer::getJdbcUrl);
        registry.add("passkeeper.datasource.username", postgresContainer::getUsername);
        registry.add("passkeeper.datasource.password", postgresContainer::getPassword);
        registry.add("passkeeper.blob-store.filesystem.path", () -> blobDir.toString());
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TokenService tokenService;

    // --- Helpers ---

    private String registerAndLogin() throws Exception {
        String login = "user-" + UUID.randomUUID();
        String credentials = objectMapper.writeValueAsString(Map.of("login", login, "password", "correct horse"));

        mockMvc.perform(post("/v1/auth/register").contentType(MediaType.APPLICATION_JSON).content(credentials))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.userId").isNotEmpty());

        MvcResult result = mockMvc.perform(post("/v1/auth/login").contentType(MediaType.APPLICATION_JSON).content(credentials))
                .andExpect(status().isOk())
                .andReturn();
        return "Bearer " + readJson(result).get("token").asText();
    }

    private String addAccount(String auth, String login, String server, String password) throws Exception {
        String body = objectMapper.writeValueAsString(Map.of("login", login, "server", server, "password", password, "meta", "2fa on"));
        MvcResult result = mockMvc.perform(post("/v1/accounts")
                        .header(HttpHeaders.AUTHORIZATION, auth)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status", is(true)))
                .andExpect(jsonPath("$.msg", startsWith("Account added: account id - ")))
                .andReturn();
        return readJson(result).get("id").asText();
    }

    private Instant syncTimestamp(String auth) throws Exception {
        MvcResult result = mockMvc.perform(get("/v1/sync").header(HttpHeaders.AUTHORIZATION, auth))
                .andExpect(status().isOk())
                .andReturn();
        return Instant.parse(readJson(result).get("timestamp").asText());
    }

    private JsonNode readJson(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString(StandardCharsets.UTF_8));
    }

    // --- Auth ---

    @Test
    @DisplayName("Register should reject a password longer than 72 bytes as a validation error")
    void register_passwordTooLong_returnsBadRequest() throws Exception {
        String credentials = objectMapper.writeValueAsString(
                Map.of("login", "long-" + UUID.randomUUID(), "password", "x".repeat(100)));

        mockMvc.perform(post("/v1/auth/register").contentType(MediaType.APPLICATION_JSON).content(credentials))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", is("password must not be longer than 72 bytes")));
    }

    @Test
    @DisplayName("Register should reject a login that is already taken")
    void register_duplicateLogin_returnsConflict() throws Exception {
        String credentials = objectMapper.writeValueAsString(Map.of("login", "dup-" + UUID.randomUUID(), "password", "pw"));
        mockMvc.perform(post("/v1/auth/register").contentType(MediaType.APPLICATION_JSON).content(credentials))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/v1/auth/register").contentType(MediaType.APPLICATION_JSON).content(credentials))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Login should reject a wrong password")
    void login_wrongPassword_returnsBadRequest() throws Exception {
        String login = "user-" + UUID.randomUUID();
        mockMvc.perform(post("/v1/auth/register").contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("login", login, "password", "right"))))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/v1/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("login", login, "password", "wrong"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", is("invalid login or password")));
    }

    @Test
    @DisplayName("Protected routes should answer 401 without a valid token")
    void protectedRoute_withoutValidToken_returnsUnauthorized() throws Exception {
        mockMvc.perform(get("/v1/accounts").param("limit", "10").with(anonymous()))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message", is("authorization token is required")));

        mockMvc.perform(get("/v1/accounts").param("limit", "10").header(HttpHeaders.AUTHORIZATION, "Bearer not.a.jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message", is("invalid token")));
    }

    @Test
    @DisplayName("Protected routes should answer 403 for a role outside the access table")
    void protectedRoute_withForeignRole_returnsForbidden() throws Exception {
        String token = tokenService.generate(UUID.randomUUID().toString(), "guest");

        mockMvc.perform(get("/v1/sync").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message", is("permission denied")));
    }

    // --- Accounts ---

    @Test
    @DisplayName("Accounts should round-trip through add, search, get and remove")
    void accounts_fullLifecycle() throws Exception {
        String auth = registerAndLogin();
        String mailId = addAccount(auth, "alice", "mail.example.com", "S3cr3t!");
        addAccount(auth, "alice", "bank.example.com", "0ther");

        mockMvc.perform(get("/v1/accounts").header(HttpHeaders.AUTHORIZATION, auth)
                        .param("substring", "MAIL").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count", is(1)))
                .andExpect(jsonPath("$.items[0].id", is(mailId)))
                .andExpect(jsonPath("$.items[0].server", is("mail.example.com")))
                .andExpect(jsonPath("$.items[0].password").doesNotExist());

        mockMvc.perform(get("/v1/accounts").header(HttpHeaders.AUTHORIZATION, auth)
                        .param("offset", "1").param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count", is(2)))
                .andExpect(jsonPath("$.items.length()", is(1)))
                .andExpect(jsonPath("$.items[0].server", is("mail.example.com")));

        mockMvc.perform(get("/v1/accounts/{id}", mailId).header(HttpHeaders.AUTHORIZATION, auth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.password", is("S3cr3t!")))
                .andExpect(jsonPath("$.meta", is("2fa on")));

        mockMvc.perform(delete("/v1/accounts/{id}", mailId).header(HttpHeaders.AUTHORIZATION, auth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.msg", is("Account removed: account id - " + mailId)));

        mockMvc.perform(get("/v1/accounts/{id}", mailId).header(HttpHeaders.AUTHORIZATION, auth))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", is("Account not found")));
    }

    @Test
    @DisplayName("Search should reject a missing limit")
    void search_withoutLimit_returnsBadRequest() throws Exception {
        String auth = registerAndLogin();

        mockMvc.perform(get("/v1/notes").header(HttpHeaders.AUTHORIZATION, auth))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", is("limit can't be 0")));
    }

    @Test
    @DisplayName("A user should not see or delete another user's secrets")
    void secrets_areIsolatedPerOwner() throws Exception {
        String aliceAuth = registerAndLogin();
        String bobAuth = registerAndLogin();
        String aliceAccount = addAccount(aliceAuth, "alice", "mail.example.com", "S3cr3t!");

        mockMvc.perform(get("/v1/accounts/{id}", aliceAccount).header(HttpHeaders.AUTHORIZATION, bobAuth))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", is("Account not found")));
        mockMvc.perform(delete("/v1/accounts/{id}", aliceAccount).header(HttpHeaders.AUTHORIZATION, bobAuth))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/v1/accounts").header(HttpHeaders.AUTHORIZATION, bobAuth).param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count", is(0)));

        mockMvc.perform(get("/v1/accounts/{id}", aliceAccount).header(HttpHeaders.AUTHORIZATION, aliceAuth))
                .andExpect(status().isOk());
    }

    // --- Cards and notes ---

    @Test
    @DisplayName("Cards should be validated, masked in search and decrypted on get")
    void cards_validateMaskAndDecrypt() throws Exception {
        String auth = registerAndLogin();

        mockMvc.perform(post("/v1/cards").header(HttpHeaders.AUTHORIZATION, auth).contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("name", "Visa", "number", "4242424242424241",
                                "month", 12, "year", 2030, "cvc", "123", "pin", "1234"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", is("invalid number value")));

        MvcResult added = mockMvc.perform(post("/v1/cards").header(HttpHeaders.AUTHORIZATION, auth).contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("name", "Visa", "number", "4242 4242 4242 4242",
                                "month", 12, "year", 2030, "cvc", "123", "pin", "1234"))))
                .andExpect(status().isCreated())
                .andReturn();
        String cardId = readJson(added).get("id").asText();

        mockMvc.perform(get("/v1/cards").header(HttpHeaders.AUTHORIZATION, auth).param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].mask", is("**** **** **** 4242")))
                .andExpect(jsonPath("$.items[0].number").doesNotExist());

        mockMvc.perform(get("/v1/cards/{id}", cardId).header(HttpHeaders.AUTHORIZATION, auth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.number", is("4242424242424242")))
                .andExpect(jsonPath("$.cvc", is("123")));
    }

    @Test
    @DisplayName("Notes should be stored and returned decrypted")
    void notes_roundTrip() throws Exception {
        String auth = registerAndLogin();

        MvcResult added = mockMvc.perform(post("/v1/notes").header(HttpHeaders.AUTHORIZATION, auth).contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("name", "wifi", "content", "hunter2"))))
                .andExpect(status().isCreated())
                .andReturn();
        String noteId = readJson(added).get("id").asText();

        mockMvc.perform(get("/v1/notes/{id}", noteId).header(HttpHeaders.AUTHORIZATION, auth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name", is("wifi")))
                .andExpect(jsonPath("$.content", is("hunter2")))
                .andExpect(jsonPath("$.meta", is("")));
    }

    // --- Files ---

    @Test
    @DisplayName("Files should be encrypted in the blob store and returned as base64")
    void files_uploadDownloadRemove() throws Exception {
        String auth = registerAndLogin();
        byte[] content = "%PDF-1.7 quarterly numbers".getBytes(StandardCharsets.UTF_8);
        MockMultipartFile part = new MockMultipartFile("content", "report.pdf", "application/pdf", content);

        MvcResult added = mockMvc.perform(multipart("/v1/files").file(part)
                        .param("name", "report.pdf").param("meta", "Q1")
                        .header(HttpHeaders.AUTHORIZATION, auth))
                .andExpect(status().isCreated())
                .andReturn();
        String fileId = readJson(added).get("id").asText();

        mockMvc.perform(multipart("/v1/files").file(part)
                        .param("name", "report.pdf")
                        .header(HttpHeaders.AUTHORIZATION, auth))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", is("file with name report.pdf already exists")));

        try (Stream<Path> blobs = Files.walk(blobDir)) {
            Path blob = blobs.filter(path -> path.getFileName().toString().equals("report.pdf")).findFirst().orElseThrow();
            byte[] stored = Files.readAllBytes(blob);
            assertThat(stored).isNotEqualTo(content);
            assertThat(new String(stored, StandardCharsets.ISO_8859_1)).doesNotContain("quarterly");
        }

        mockMvc.perform(get("/v1/files/{id}", fileId).header(HttpHeaders.AUTHORIZATION, auth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.meta", is("Q1")))
                .andExpect(jsonPath("$.content", is(Base64.getEncoder().encodeToString(content))));

        mockMvc.perform(delete("/v1/files/{id}", fileId).header(HttpHeaders.AUTHORIZATION, auth))
                .andExpect(status().isOk());

        mockMvc.perform(get("/v1/files").header(HttpHeaders.AUTHORIZATION, auth).param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count", is(0)));
    }

    // --- Sync ---

    @Test
    @DisplayName("Sync should be missing before the first mutation and never move backwards")
    void sync_tracksLastMutation() throws Exception {
        String auth = registerAndLogin();

        mockMvc.perform(get("/v1/sync").header(HttpHeaders.AUTHORIZATION, auth))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", is("sync timestamp not found")));

        String accountId = addAccount(auth, "alice", "mail.example.com", "S3cr3t!");
        Instant afterAdd = syncTimestamp(auth);

        mockMvc.perform(get("/v1/accounts").header(HttpHeaders.AUTHORIZATION, auth).param("limit", "10"))
                .andExpect(status().isOk());
        assertThat(syncTimestamp(auth)).isEqualTo(afterAdd);

        mockMvc.perform(delete("/v1/accounts/{id}", accountId).header(HttpHeaders.AUTHORIZATION, auth))
                .andExpect(status().isOk());
        assertThat(syncTimestamp(auth)).isAfterOrEqualTo(afterAdd);
    }

    @Test
    @DisplayName("Sync marker should only move for the owner whose data changed")
    void sync_isIsolatedBetweenOwners() throws Exception {
        String aliceAuth = registerAndLogin();
        String bobAuth = registerAndLogin();

        addAccount(aliceAuth, "alice", "mail.example.com", "S3cr3t!");
        Instant aliceMarker = syncTimestamp(aliceAuth);

        String bobAccountId = addAccount(bobAuth, "bob", "git.example.com", "hunter2");
        mockMvc.perform(delete("/v1/accounts/{id}", bobAccountId).header(HttpHeaders.AUTHORIZATION, bobAuth))
                .andExpect(status().isOk());

        assertThat(syncTimestamp(bobAuth)).isAfterOrEqualTo(aliceMarker);
        assertThat(syncTimestamp(aliceAuth)).isEqualTo(aliceMarker);
    }
}
