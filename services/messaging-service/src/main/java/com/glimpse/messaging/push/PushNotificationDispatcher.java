package com.glimpse.messaging.push;

import com.glimpse.messaging.queue.PushNotification;

public interface PushNotificationDispatcher {

    void dispatch(PushNotification notification);
}
