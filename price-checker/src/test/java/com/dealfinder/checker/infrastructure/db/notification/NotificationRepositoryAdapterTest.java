package com.dealfinder.checker.infrastructure.db.notification;

import com.dealfinder.checker.domain.notification.Channel;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationRepositoryAdapterTest {

    @Test
    void shouldJoinChannelsInStableOrder() {
        assertThat(NotificationRepositoryAdapter.joinChannels(EnumSet.of(Channel.SMS, Channel.EMAIL))).isEqualTo("EMAIL,SMS");
    }

    @Test
    void shouldStoreNoChannelsAsEmptyString() {
        assertThat(NotificationRepositoryAdapter.joinChannels(Set.of())).isEmpty();
        assertThat(NotificationRepositoryAdapter.joinChannels(null)).isEmpty();
    }
}
