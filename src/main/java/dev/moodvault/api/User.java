/* Moodvault © 2025 — MIT */
package dev.moodvault.api;

/**
 * Registered diary user.
 *
 * @param id owner identifier
 * @param displayName optional display name
 * @param notificationTime daily reminder time as {@code HH:MM}, or {@code null} when disabled
 */
public record User(long id, String displayName, String notificationTime) {}
