package com.codeheadsystems.tether.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for a front end sharing the Tether session store.
 * <p>
 * Every front end that should share a login must point {@code credentialFile} and
 * {@code sessionDatabase} at the same files and use the same {@code cookieName}.
 */
public class TetherConfiguration extends Configuration {

  /**
   * YAML credential registry shared by all front ends.
   */
  @NotEmpty
  private String credentialFile = "config/credentials.yaml";

  /**
   * SQLite session database shared by all front ends.
   */
  @NotEmpty
  private String sessionDatabase = "data/sessions.db";

  /**
   * Lifetime of a new session; also the cookie max-age. Defaults to 30 days.
   */
  @Min(60)
  private long sessionTtlSeconds = 30L * 24 * 60 * 60;

  /**
   * How long a statement waits on a locked session database before failing.
   */
  @Min(0)
  private int busyTimeoutMillis = 5000;

  @NotEmpty
  private String cookieName = "tether_session_id";

  /**
   * Query parameter that carries the session id on links between front ends.
   */
  @NotEmpty
  private String linkParameter = "sessionId";

  /**
   * Mark the session cookie Secure. Enable whenever the front ends are served over HTTPS.
   */
  private boolean secureCookie = false;

  /**
   * Idle time after which this process forgets its cached identity for a browser. The shared
   * session is unaffected; the next request restores it from the cookie.
   */
  @Min(60)
  private int servletSessionIdleSeconds = 1800;

  /**
   * Name of this process's own servlet session cookie. Front ends on one host see each other's
   * cookies, so each needs a distinct name. Defaults to one derived from the application name.
   */
  private String servletSessionCookieName;

  /**
   * Interval between expired-session sweeps. Zero disables the sweeper.
   */
  @Min(0)
  private long sweepIntervalSeconds = 3600;

  /**
   * Argon2id memory cost in KiB for new password hashes.
   */
  @Min(8)
  private int argon2MemoryKib = 65536;

  @Min(1)
  private int argon2Iterations = 3;

  @Min(1)
  private int argon2Parallelism = 1;

  @JsonProperty
  public String getCredentialFile() {
    return credentialFile;
  }

  @JsonProperty
  public void setCredentialFile(String credentialFile) {
    this.credentialFile = credentialFile;
  }

  @JsonProperty
  public String getSessionDatabase() {
    return sessionDatabase;
  }

  @JsonProperty
  public void setSessionDatabase(String sessionDatabase) {
    this.sessionDatabase = sessionDatabase;
  }

  @JsonProperty
  public long getSessionTtlSeconds() {
    return sessionTtlSeconds;
  }

  @JsonProperty
  public void setSessionTtlSeconds(long sessionTtlSeconds) {
    this.sessionTtlSeconds = sessionTtlSeconds;
  }

  @JsonProperty
  public int getBusyTimeoutMillis() {
    return busyTimeoutMillis;
  }

  @JsonProperty
  public void setBusyTimeoutMillis(int busyTimeoutMillis) {
    this.busyTimeoutMillis = busyTimeoutMillis;
  }

  @JsonProperty
  public String getCookieName() {
    return cookieName;
  }

  @JsonProperty
  public void setCookieName(String cookieName) {
    this.cookieName = cookieName;
  }

  @JsonProperty
  public String getLinkParameter() {
    return linkParameter;
  }

  @JsonProperty
  public void setLinkParameter(String linkParameter) {
    this.linkParameter = linkParameter;
  }

  @JsonProperty
  public boolean isSecureCookie() {
    return secureCookie;
  }

  @JsonProperty
  public void setSecureCookie(boolean secureCookie) {
    this.secureCookie = secureCookie;
  }

  @JsonProperty
  public int getServletSessionIdleSeconds() {
    return servletSessionIdleSeconds;
  }

  @JsonProperty
  public void setServletSessionIdleSeconds(int servletSessionIdleSeconds) {
    this.servletSessionIdleSeconds = servletSessionIdleSeconds;
  }

  @JsonProperty
  public String getServletSessionCookieName() {
    return servletSessionCookieName;
  }

  @JsonProperty
  public void setServletSessionCookieName(String servletSessionCookieName) {
    this.servletSessionCookieName = servletSessionCookieName;
  }

  @JsonProperty
  public long getSweepIntervalSeconds() {
    return sweepIntervalSeconds;
  }

  @JsonProperty
  public void setSweepIntervalSeconds(long sweepIntervalSeconds) {
    this.sweepIntervalSeconds = sweepIntervalSeconds;
  }

  @JsonProperty
  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  @JsonProperty
  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  @JsonProperty
  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  @JsonProperty
  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  @JsonProperty
  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  @JsonProperty
  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }
}
