/**
 * Credential Forge core package.
 *
 * <p>
 * Plans, schedules and aggregates batches of synthetic document generation jobs. This
 * package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.credentialforge;

import org.jspecify.annotations.NullMarked;
