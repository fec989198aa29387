/**
 * Internal helpers: argument validation, the flat JSON codec, hashing and thread factories.
 */
package relay.util;
