package com.musicbackup.sync;

/**
 * What a caller needs to decide whether to offer "resume".
 */
public record ResumeInfo(
    boolean canResume,
    int playlistsCompleted,
    int playlistsTotal,
    boolean likedSongsCompleted,
    InterruptionReason reason,
    RateLimitStatus rateLimit
) {
    public static ResumeInfo none() {
        return new ResumeInfo(false, 0, 0, false, null, null);
    }
}
