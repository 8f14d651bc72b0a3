package com.techStack.geoAccess.config.intergration;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.cloud.FirestoreClient;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Firebase Configuration
 *
 * Configures the Firebase App and the Firestore client that backs every security collection.
 */
@Configuration
@Slf4j
public class FirebaseConfig {

    @Value("${firebase.service-account.path:}")
    private String serviceAccountPath;

    @Value("${firebase.project-id}")
    private String projectId;

    @Bean
    public FirebaseApp firebaseApp(Clock clock) throws IOException {
        Instant startTime = clock.instant();

        if (!FirebaseApp.getApps().isEmpty()) {
            log.info("Using existing Firebase application instance");
            return FirebaseApp.getInstance();
        }

        log.info("Initializing Firebase App at {}", startTime);

        FirebaseOptions options = FirebaseOptions.builder()
                .setCredentials(loadCredentials())
                .setProjectId(projectId)
                .build();

        FirebaseApp app = FirebaseApp.initializeApp(options);

        log.info("Firebase application initialized for project {} (duration: {})",
                projectId, Duration.between(startTime, clock.instant()));
        return app;
    }

    @Bean
    public Firestore firestore(FirebaseApp firebaseApp) {
        Firestore firestore = FirestoreClient.getFirestore(firebaseApp);
        log.info("Firestore initialized for project {}", projectId);
        return firestore;
    }

    /**
     * Service account from the classpath when configured, application default credentials otherwise.
     */
    private GoogleCredentials loadCredentials() throws IOException {
        if (StringUtils.isBlank(serviceAccountPath)) {
            log.info("No service account configured, using application default credentials");
            return GoogleCredentials.getApplicationDefault();
        }

        InputStream serviceAccount = getClass()
                .getClassLoader()
                .getResourceAsStream(serviceAccountPath);

        if (serviceAccount == null) {
            log.error("Firebase service account file not found: {}", serviceAccountPath);
            throw new IllegalStateException(
                    "Firebase service account file not found in classpath: " + serviceAccountPath);
        }

        try (serviceAccount) {
            return GoogleCredentials.fromStream(serviceAccount);
        }
    }
}
