package com.libragraph.backup.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.backup.archivers.store.InteractionStoreException;
import com.libragraph.backup.archivers.store.InteractionVisitor.VisitResult;
import com.libragraph.backup.archivers.testing.ChatFixtures;
import com.libragraph.backup.core.dao.InteractionDao;
import com.libragraph.backup.core.dao.InteractionKind;
import com.libragraph.backup.core.dao.InteractionRecord;
import com.libragraph.backup.types.model.IncomingMessage;
import com.libragraph.backup.types.model.Interaction;
import org.jdbi.v3.core.ConnectionException;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.result.ResultIterator;
import org.jdbi.v3.core.statement.StatementContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class JdbiInteractionStoreTest {

    private final InteractionCodec codec = InteractionCodec.of(new ObjectMapper());
    private final Handle tx = mock(Handle.class);
    private final InteractionDao dao = mock(InteractionDao.class);
    private JdbiInteractionStore store;

    @BeforeEach
    void setUp() {
        when(tx.attach(InteractionDao.class)).thenReturn(dao);
        store = new JdbiInteractionStore();
        store.codec = codec;
    }

    @Test
    void enumeratesInRowOrder() {
        var rows = new ListIterator(row(1, 1_000), row(2, 2_000), row(3, 3_000));
        when(dao.iterateAll()).thenReturn(rows);
        List<Long> seen = new ArrayList<>();

        store.enumerateAll(tx, i -> {
            seen.add(i.rowId());
            return VisitResult.CONTINUE;
        });

        assertThat(seen).containsExactly(1L, 2L, 3L);
        assertThat(rows.closed).isTrue();
    }

    @Test
    void stopEndsEnumerationAndClosesCursor() {
        var rows = new ListIterator(row(1, 1_000), row(2, 2_000), row(3, 3_000));
        when(dao.iterateAll()).thenReturn(rows);
        List<Interaction> seen = new ArrayList<>();

        store.enumerateAll(tx, i -> {
            seen.add(i);
            return seen.size() == 2 ? VisitResult.STOP : VisitResult.CONTINUE;
        });

        assertThat(seen).hasSize(2);
        assertThat(rows.closed).isTrue();
    }

    @Test
    void databaseFaultBecomesStoreException() {
        when(dao.iterateAll()).thenThrow(new ConnectionException(new SQLException("connection reset")));

        assertThatThrownBy(() -> store.enumerateAll(tx, i -> VisitResult.CONTINUE))
                .isInstanceOf(InteractionStoreException.class)
                .hasCauseInstanceOf(ConnectionException.class);
    }

    @Test
    void insertWritesColumnsAndPayload() {
        when(dao.insert(anyString(), anyString(), anyShort(), anyLong(), any(), anyShort(), any(), anyString()))
                .thenReturn(17L);
        IncomingMessage message = ChatFixtures.incoming(1_000, "hello");

        long rowId = store.insertPastRevision(message, 9, tx);

        assertThat(rowId).isEqualTo(17);
        verify(dao).insert(eq("in-1000"), eq(ChatFixtures.ALICE_THREAD.value()),
                eq((short) InteractionKind.INCOMING.id()), eq(1_000L), eq(ChatFixtures.ALICE), eq((short) 0),
                eq(9L), anyString());
    }

    @Test
    void outgoingMessageHasNoAuthorColumn() {
        store.insert(ChatFixtures.outgoing(1_000, "hi"), tx);

        verify(dao).insert(eq("out-1000"), anyString(), eq((short) InteractionKind.OUTGOING.id()), eq(1_000L),
                isNull(), anyShort(), isNull(), anyString());
    }

    private InteractionRecord row(long id, long timestamp) {
        return new InteractionRecord(id, "in-" + timestamp, ChatFixtures.ALICE_THREAD.value(),
                (short) InteractionKind.INCOMING.id(), timestamp, (short) 0, null,
                codec.encode(ChatFixtures.incoming(timestamp, "m" + id)));
    }

    private static final class ListIterator implements ResultIterator<InteractionRecord> {

        private final Iterator<InteractionRecord> rows;
        private boolean closed;

        ListIterator(InteractionRecord... rows) {
            this.rows = List.of(rows).iterator();
        }

        @Override
        public boolean hasNext() {
            return rows.hasNext();
        }

        @Override
        public InteractionRecord next() {
            return rows.next();
        }

        @Override
        public void close() {
            closed = true;
        }

        @Override
        public StatementContext getContext() {
            return null;
        }
    }
}
