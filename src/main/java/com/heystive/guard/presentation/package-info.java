/**
 * HTTP boundary: REST controllers, the credential interceptor and exception mapping.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - endpoints under {@code /api} plus {@code /ping}</li>
 *   <li>{@code presentation.security} - extracts and authenticates the presented credential</li>
 *   <li>{@code presentation.exception} - maps domain exceptions to status codes</li>
 * </ul>
 *
 * <p>Controllers stay thin: permission checks and business logic live in services, and
 * controllers throw domain exceptions only.
 */
package com.heystive.guard.presentation;
