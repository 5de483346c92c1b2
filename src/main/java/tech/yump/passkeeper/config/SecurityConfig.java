package tech.yump.passkeeper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import tech.yump.passkeeper.auth.AccessControlFilter;
import tech.yump.passkeeper.auth.policy.AccessPolicyRepository;
import tech.yump.passkeeper.auth.token.TokenService;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
@Slf4j
public class SecurityConfig {

  private final AccessPolicyRepository accessPolicyRepository;
  private final TokenService tokenService;
  private final ObjectMapper objectMapper;

  @Bean
  public PasswordEncoder passwordEncoder() {
    return new BCryptPasswordEncoder();
  }

  @Bean
  public AccessControlFilter accessControlFilter() {
    log.debug("Creating AccessControlFilter.");
    return new AccessControlFilter(accessPolicyRepository, tokenService, objectMapper);
  }

  // Runs inside the security filter chain only, not as a second servlet filter
  @Bean
  public FilterRegistrationBean<AccessControlFilter> accessControlFilterRegistration(AccessControlFilter accessControlFilter) {
    FilterRegistrationBean<AccessControlFilter> registration = new FilterRegistrationBean<>(accessControlFilter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    log.info("Configuring Spring Security with token authentication and per-operation access rules.");
    http
            .csrf(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .addFilterBefore(accessControlFilter(), UsernamePasswordAuthenticationFilter.class)
            // Access decisions are made by AccessControlFilter from passkeeper.access.rules
            .authorizeHttpRequests(authz -> authz.anyRequest().permitAll());
    return http.build();
  }
}
