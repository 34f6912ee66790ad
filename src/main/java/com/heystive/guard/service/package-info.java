/**
 * Service layer.
 *
 * <ul>
 *   <li>{@code service.security} - credential validation, rate limiting, IP reputation,
 *       session tokens and the audit log, all held by one {@code SecurityContext}</li>
 *   <li>{@code service.sandbox} - command validation and out-of-process skill execution</li>
 *   <li>{@code service.permission} - persisted permission grants</li>
 *   <li>{@code service.skill} - skills, routing and plan execution</li>
 *   <li>{@code service.events}, {@code service.metrics}, {@code service.health} - observability</li>
 * </ul>
 */
package com.heystive.guard.service;
