/**
 * Application-specific exception hierarchy.
 *
 * <p>Every exception extends {@link com.heystive.guard.exception.HeystiveException} so the
 * REST boundary can translate them uniformly:
 * <ul>
 *   <li>{@link com.heystive.guard.exception.AuthenticationException} - missing, malformed,
 *       blacklisted or unknown credential</li>
 *   <li>{@link com.heystive.guard.exception.RateLimitExceededException} - tier budget used up;
 *       carries {@code retry_after}</li>
 *   <li>{@link com.heystive.guard.exception.IpBlockedException} - source address temporarily blocked</li>
 *   <li>{@link com.heystive.guard.exception.PermissionDeniedException} - missing credential
 *       permission or ungranted skill permission</li>
 *   <li>{@link com.heystive.guard.exception.SecurityViolationException} - command rejected
 *       before any process was spawned</li>
 *   <li>{@link com.heystive.guard.exception.SandboxTimeoutException} and
 *       {@link com.heystive.guard.exception.SandboxExecutionException} - sandboxed skill killed
 *       on timeout or exited non-zero</li>
 *   <li>{@link com.heystive.guard.exception.SkillNotFoundException} - unknown skill name</li>
 *   <li>{@link com.heystive.guard.exception.ExpiredSignatureException} and
 *       {@link com.heystive.guard.exception.InvalidSignatureException} - rejected session tokens</li>
 * </ul>
 *
 * @see com.heystive.guard.presentation.exception.GlobalExceptionHandler
 */
package com.heystive.guard.exception;
