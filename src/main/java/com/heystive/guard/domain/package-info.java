/**
 * Immutable domain types shared by the security, sandbox and skill services.
 *
 * <p>All types are records or enums; collections passed in are copied on construction.
 */
package com.heystive.guard.domain;
