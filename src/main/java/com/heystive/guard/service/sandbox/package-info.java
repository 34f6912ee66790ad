/**
 * Sandboxed execution of skill executables.
 *
 * <p>{@link com.heystive.guard.service.sandbox.CommandValidator} is consulted before any
 * process starts. {@link com.heystive.guard.service.sandbox.SkillSandboxExecutor} spawns
 * through the package-private {@code ProcessFactory} seam so tests can substitute fake
 * processes.
 */
package com.heystive.guard.service.sandbox;
