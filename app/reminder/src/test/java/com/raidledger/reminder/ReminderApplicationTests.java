package com.raidledger.reminder;

import static org.assertj.core.api.Assertions.assertThat;

import com.raidledger.reminder.service.LocalNotificationGateway;
import com.raidledger.reminder.service.NotificationGateway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ReminderApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private NotificationGateway notificationGateway;

  @Test
  void contextLoadsWithLocalGatewayWhenNatsIsDisabled() {
    assertThat(notificationGateway).isInstanceOf(LocalNotificationGateway.class);
  }
}
