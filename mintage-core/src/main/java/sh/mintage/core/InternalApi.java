// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a type or method as internal API not intended for public use.
 *
 * <p>Elements annotated with {@code @InternalApi} are public only because a host
 * implementation in another package must reach them (for example, snapshotting
 * resources before a transaction). Ledger clients should not call them; they may
 * change without notice.
 *
 * @since 0.1.0
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
public @interface InternalApi {
}
