package com.yerin.notijob.cache;

import java.util.Iterator;
import java.util.List;

/**
 * SCAN 커서 위에서 키를 페이지 단위로 돌려준다. 페이지를 다 읽기 전에 멈추면 close 해야 한다.
 */
public interface KeyPageCursor extends Iterator<List<String>>, AutoCloseable {

    @Override
    void close();
}
