package com.netcracker.core.provisioning.refresh;

import com.netcracker.core.provisioning.apply.ApplyConfig;
import com.netcracker.core.provisioning.apply.BackoffStrategy;
import com.netcracker.core.provisioning.exception.ProvisioningException;
import com.netcracker.core.provisioning.model.ResourceAddress;
import com.netcracker.core.provisioning.model.ResourceState;
import com.netcracker.core.provisioning.model.StateSnapshot;
import com.netcracker.core.provisioning.provider.ProviderRegistry;
import com.netcracker.core.provisioning.provider.ProviderResult;
import com.netcracker.core.provisioning.provider.ProviderTransientException;
import com.netcracker.core.provisioning.support.FakeCloud;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateRefresherTest {
    private static final ResourceAddress BUCKET = ResourceAddress.parse("bucket.logs");
    private static final BackoffStrategy NO_WAIT = (current, min, max) -> Duration.ZERO;

    private FakeCloud cloud;
    private StateRefresher refresher;
    private StateSnapshot state;
    private String bucketId;

    @BeforeEach
    void setUp() {
        cloud = new FakeCloud();
        ProviderRegistry registry = cloud.standardRegistry();
        refresher = new StateRefresher(registry, ApplyConfig.builder().maxAttempts(3).build(), NO_WAIT);
        ProviderResult created = registry.get("bucket").create(Map.of("acl", "private"));
        bucketId = created.id();
        state = StateSnapshot.empty().put(new ResourceState(BUCKET, bucketId, Map.of("acl", "private"), created.attributes(), Set.of()));
    }

    @Test
    void unchangedObjectsLeaveSnapshotAsIs() {
        assertThat(refresher.refresh(state)).isSameAs(state);
    }

    @Test
    void remoteChangesShowUpInInputsAndAttributes() {
        cloud.modifyOutOfBand(bucketId, "acl", "public-read");

        StateSnapshot refreshed = refresher.refresh(state);

        ResourceState bucket = refreshed.get(BUCKET).orElseThrow();
        assertThat(bucket.inputs()).containsEntry("acl", "public-read");
        assertThat(bucket.attributes()).containsEntry("acl", "public-read");
        assertThat(refreshed.getSerial()).isGreaterThan(state.getSerial());
    }

    @Test
    void objectsDeletedOutOfBandAreDropped() {
        cloud.deleteOutOfBand(bucketId);

        assertThat(refresher.refresh(state).contains(BUCKET)).isFalse();
    }

    @Test
    void transientReadErrorsAreRetried() {
        cloud.failNext("read", "bucket", new ProviderTransientException("throttled"), new ProviderTransientException("throttled"));

        assertThat(refresher.refresh(state)).isSameAs(state);
        assertThat(cloud.count("read", "bucket")).isEqualTo(1);
    }

    @Test
    void persistentReadErrorsAbortRefresh() {
        cloud.failAlways("read", "bucket", () -> new ProviderTransientException("throttled"));

        assertThatThrownBy(() -> refresher.refresh(state))
                .isInstanceOf(ProvisioningException.class)
                .hasMessageContaining(BUCKET.toString());
    }
}
