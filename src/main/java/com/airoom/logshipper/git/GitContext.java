package com.airoom.logshipper.git;

/** 작업 디렉터리의 git 원격 주소와 HEAD 커밋. 알 수 없으면 각각 null */
public record GitContext(String remoteUrl, String commitHash) {

    public static final GitContext NONE = new GitContext(null, null);

    public boolean isPresent() {
        return remoteUrl != null || commitHash != null;
    }
}
