package com.demo.altcredit.service.refresh;

/** Whether a background cycle may replace a profile whose cached assessment came from the remote backend. */
public enum RefreshOverwritePolicy {
    /** Background cycles always replace the cached profile. */
    OVERWRITE,
    /** Background cycles leave the cache alone while it backs a remote-scored assessment. */
    PRESERVE_REMOTE
}
