/**
 * Bearer credential validation for Bastion services.
 *
 * <p>{@link com.bastion.security.CredentialValidator} is the entry point: it parses the
 * {@code Authorization} header with {@link com.bastion.security.BearerTokenExtractor} and
 * resolves the token through an {@link com.bastion.security.IdentityProvider} into a
 * {@link com.bastion.security.Principal}. Adapters for concrete providers live in sub-packages.
 */
package com.bastion.security;
