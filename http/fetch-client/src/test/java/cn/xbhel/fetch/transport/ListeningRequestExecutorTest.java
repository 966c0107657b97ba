package cn.xbhel.fetch.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.net.InetAddress;

import org.apache.http.HttpClientConnection;
import org.apache.http.conn.ManagedHttpClientConnection;
import org.junit.jupiter.api.Test;

class ListeningRequestExecutorTest {

    @Test
    void testConnectionId_usesSocketAddresses() throws Exception {
        var connection = mock(ManagedHttpClientConnection.class);
        when(connection.getLocalAddress()).thenReturn(InetAddress.getByName("127.0.0.1"));
        when(connection.getLocalPort()).thenReturn(50000);
        when(connection.getRemoteAddress()).thenReturn(InetAddress.getByName("127.0.0.1"));
        when(connection.getRemotePort()).thenReturn(8080);

        assertEquals("127.0.0.1:50000->127.0.0.1:8080", ListeningRequestExecutor.connectionId(connection));
    }

    @Test
    void testConnectionId_unboundConnection() {
        var connection = mock(HttpClientConnection.class);
        assertEquals(Integer.toHexString(System.identityHashCode(connection)),
                ListeningRequestExecutor.connectionId(connection));
    }

    @Test
    void testConnectionId_closedConnection() {
        var connection = mock(ManagedHttpClientConnection.class);
        assertThat(ListeningRequestExecutor.connectionId(connection)).isNotBlank();
    }

}
