package tech.yump.passkeeper.auth;

import org.springframework.http.HttpMethod;
import org.springframework.http.server.PathContainer;
import org.springframework.web.util.pattern.PathPattern;
import org.springframework.web.util.pattern.PathPatternParser;

import java.util.Arrays;
import java.util.Optional;

/**
 * Catalog of the API's logical operations and the HTTP routes they are served on.
 * The access table in {@code passkeeper.access.rules} refers to operations by {@link #operationName()}.
 */
public enum VaultOperation {

    AUTH_REGISTER("Auth.Register", HttpMethod.POST, "/v1/auth/register"),
    AUTH_LOGIN("Auth.Login", HttpMethod.POST, "/v1/auth/login"),

    ACCOUNTS_ADD("Accounts.Add", HttpMethod.POST, "/v1/accounts"),
    ACCOUNTS_SEARCH("Accounts.Search", HttpMethod.GET, "/v1/accounts"),
    ACCOUNTS_GET_SECRET("Accounts.GetSecret", HttpMethod.GET, "/v1/accounts/{id}"),
    ACCOUNTS_REMOVE("Accounts.Remove", HttpMethod.DELETE, "/v1/accounts/{id}"),

    CARDS_ADD("Cards.Add", HttpMethod.POST, "/v1/cards"),
    CARDS_SEARCH("Cards.Search", HttpMethod.GET, "/v1/cards"),
    CARDS_GET_SECRET("Cards.GetSecret", HttpMethod.GET, "/v1/cards/{id}"),
    CARDS_REMOVE("Cards.Remove", HttpMethod.DELETE, "/v1/cards/{id}"),

    NOTES_ADD("Notes.Add", HttpMethod.POST, "/v1/notes"),
    NOTES_SEARCH("Notes.Search", HttpMethod.GET, "/v1/notes"),
    NOTES_GET_SECRET("Notes.GetSecret", HttpMethod.GET, "/v1/notes/{id}"),
    NOTES_REMOVE("Notes.Remove", HttpMethod.DELETE, "/v1/notes/{id}"),

    FILES_ADD("Files.Add", HttpMethod.POST, "/v1/files"),
    FILES_SEARCH("Files.Search", HttpMethod.GET, "/v1/files"),
    FILES_GET_SECRET("Files.GetSecret", HttpMethod.GET, "/v1/files/{id}"),
    FILES_REMOVE("Files.Remove", HttpMethod.DELETE, "/v1/files/{id}"),

    SYNC_GET("Sync.Get", HttpMethod.GET, "/v1/sync");

    private final String operationName;
    private final HttpMethod method;
    private final PathPattern pathPattern;

    VaultOperation(String operationName, HttpMethod method, String pathPattern) {
        this.operationName = operationName;
        this.method = method;
        this.pathPattern = PathPatternParser.defaultInstance.parse(pathPattern);
    }

    public String operationName() {
        return operationName;
    }

    public boolean matches(String httpMethod, String path) {
        return method.matches(httpMethod) && pathPattern.matches(PathContainer.parsePath(path));
    }

    /**
     * Resolves the operation served on the given route.
     *
     * @param httpMethod the request method, e.g. "GET"
     * @param path       the request path relative to the context path
     * @return the operation, or empty if the route is not part of the catalog
     */
    public static Optional<VaultOperation> resolve(String httpMethod, String path) {
        if (httpMethod == null || path == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(operation -> operation.matches(httpMethod, path))
                .findFirst();
    }
}
