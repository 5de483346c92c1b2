package tech.yump.passkeeper.auth.policy;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.passkeeper.config.PassKeeperProperties;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Holds the operation to allowed-roles table loaded from {@code passkeeper.access.rules}.
 * Operations absent from the table are public.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessPolicyRepository {

    private final PassKeeperProperties properties;
    private Map<String, Set<String>> allowedRoles = Collections.emptyMap();

    @PostConstruct
    void initialize() {
        List<OperationRule> rules = Optional.ofNullable(properties.access())
                .map(PassKeeperProperties.AccessProperties::rules)
                .orElse(Collections.emptyList());

        if (rules.isEmpty()) {
            log.warn("No access rules defined in configuration (passkeeper.access.rules). Every operation is public.");
            return;
        }
        this.allowedRoles = rules.stream()
                .collect(Collectors.toUnmodifiableMap(
                        OperationRule::operation,
                        rule -> Set.copyOf(rule.roles()),
                        (existing, replacement) -> {
                            log.warn("Duplicate access rule found in configuration. Using the first occurrence: {}", existing);
                            return existing;
                        }));
        log.info("Loaded access rules for {} operations.", allowedRoles.size());
        log.debug("Protected operations: {}", allowedRoles.keySet());
    }

    /**
     * @return the roles allowed to call the operation, or empty when the operation is not protected
     */
    public Optional<Set<String>> findAllowedRoles(String operation) {
        if (operation == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(allowedRoles.get(operation));
    }
}
