package com.airoom.logshipper.git;

import java.nio.file.Path;

/** 최선 노력 조회. 실패는 예외가 아니라 GitContext.NONE 으로 돌려준다 */
@FunctionalInterface
public interface GitContextResolver {

    GitContext resolve(Path directory);

    GitContextResolver NONE = dir -> GitContext.NONE;
}
