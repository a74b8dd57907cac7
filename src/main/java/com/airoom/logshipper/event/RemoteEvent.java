package com.airoom.logshipper.event;

import com.google.gson.JsonObject;
import com.google.gson.annotations.SerializedName;

/**
 * 원격 수집 서버로 보내는 본문.
 * eventData 는 마스킹된 사본이어야 한다 (EventRedactor 통과 후).
 */
public record RemoteEvent(
        @SerializedName("file_name") String fileName,
        @SerializedName("line_number") int lineNumber,
        @SerializedName("event_data") JsonObject eventData,
        @SerializedName("git_remote_url") String gitRemoteUrl,
        @SerializedName("git_commit_hash") String gitCommitHash
) {}
