package com.eia.api.clients;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;

import java.io.IOException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.eia.api.config.EiaClientConfig;

@ExtendWith(MockitoExtension.class)
public class EiaApiClientTest {

    @Mock
    private EiaApiBase apiBase;

    @Test
    public void testCloseReleasesTransport() throws IOException {
        EiaClientConfig config = EiaClientConfig.builder().apiKey("test-key").build();

        try (EiaApiClient client = new EiaApiClient(config, apiBase)) {
            assertSame(apiBase, client.base());
            assertNotNull(client.data());
        }

        verify(apiBase).close();
    }

    @Test
    public void testClientBuiltFromConfigCloses() throws IOException {
        EiaClientConfig config = EiaClientConfig.builder().apiKey("test-key").concurrency(2).build();

        EiaApiClient client = new EiaApiClient(config);
        assertSame(config, client.getConfig());
        assertDoesNotThrow(client::close);
    }
}
