package com.mockbuster.server.domain.common.exception;

import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class DatabaseExceptionTest {

    @Test
    void 원인_메시지를_문맥_뒤에_붙인다() {
        // given
        QueryTimeoutException cause = new QueryTimeoutException("statement timeout");

        // when
        DatabaseException e = new DatabaseException("error querying films", cause);

        // then
        assertThat(e).hasMessage("error querying films: statement timeout");
        assertThat(e.getCause()).isSameAs(cause);
    }

    @Test
    void 원인_메시지가_없으면_예외_이름을_쓴다() {
        // when
        DatabaseException e = new DatabaseException("error inserting comment", new NullPointerException());

        // then
        assertThat(e).hasMessage("error inserting comment: NullPointerException");
    }
}
