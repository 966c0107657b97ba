package cn.xbhel.fetch.retry;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;

import cn.xbhel.fetch.HttpExecutionException;
import cn.xbhel.fetch.HttpResponse;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * One try of a request, including every redirect hop it followed.
 *
 * @author xbhel
 */
@Getter
@ToString
public class Attempt {

    private final int ordinal;
    private final Instant startedAt;
    private final List<URI> redirectUrls = new ArrayList<>();
    private final List<String> connectionIds = new ArrayList<>();

    @Nullable
    @Setter
    private URI currentUrl;
    @Nullable
    @Setter
    private HttpExecutionException error;
    @Nullable
    @Setter
    private HttpResponse response;

    Attempt(int ordinal, Instant startedAt) {
        if (ordinal < 1) {
            throw new IllegalArgumentException("The attempt ordinal starts at 1, got " + ordinal);
        }
        this.ordinal = ordinal;
        this.startedAt = startedAt;
    }

    /**
     * The number of retries that preceded this attempt.
     */
    public int getRetryCount() {
        return ordinal - 1;
    }

    public List<URI> getRedirectUrls() {
        return Collections.unmodifiableList(redirectUrls);
    }

    public List<String> getConnectionIds() {
        return Collections.unmodifiableList(connectionIds);
    }

    public void addRedirect(URI target) {
        redirectUrls.add(target);
        currentUrl = target;
    }

    public void addConnection(String connectionId) {
        connectionIds.add(connectionId);
    }

}
