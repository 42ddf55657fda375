// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.store;

/**
 * Journal form of a registered soul.
 *
 * @param id              soul id
 * @param publicKey       compressed public key, hex
 * @param paradigm        optional paradigm tag, may be null
 * @param mode            optional mode tag, may be null
 * @param createdAtMillis registration time, epoch millis
 */
public record SoulRecord(String id, String publicKey, String paradigm, String mode, long createdAtMillis) {
}
