package com.worksync.collaboration.config;

import com.worksync.collaboration.service.IdentityResolver;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;

@Configuration
@EnableConfigurationProperties(RealtimeProperties.class)
public class SecurityConfig {

  @Bean
  BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter(IdentityResolver identityResolver) {
    return new BearerTokenAuthenticationFilter(identityResolver);
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter,
      RealtimeProperties realtimeProperties)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .exceptionHandling(ex -> ex.authenticationEntryPoint(authenticationEntryPoint()))
        .addFilterBefore(bearerTokenAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    // the handshake interceptor authenticates the upgrade itself
                    .requestMatchers(realtimeProperties.endpoint())
                    .permitAll()
                    .requestMatchers("/notifications/**", "/notifications")
                    .hasRole("USER")
                    .anyRequest()
                    .authenticated());
    return http.build();
  }

  @Bean
  AuthenticationEntryPoint authenticationEntryPoint() {
    return new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED);
  }

  // registered in the security chain only, not as a second servlet filter
  @Bean
  FilterRegistrationBean<BearerTokenAuthenticationFilter> bearerTokenFilterRegistration(
      BearerTokenAuthenticationFilter filter) {
    final FilterRegistrationBean<BearerTokenAuthenticationFilter> registration =
        new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }
}
