package likelion._th.roadwatch.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Configuration
@Slf4j
public class FirebaseConfig {

    // 서비스 계정 JSON 전체를 환경변수로 받음 (FIREBASE_CREDENTIALS)
    @Value("${firebase.credentials-json:}")
    private String credentialsJson;

    @Value("${firebase.project-id:}")
    private String projectId;

    private GoogleCredentials loadCredentials() throws IOException {
        if (credentialsJson == null || credentialsJson.isBlank()) {
            log.warn("[Firebase] credentials-json 이 비어있습니다. Application Default Credentials 사용");
            return GoogleCredentials.getApplicationDefault();
        }

        // 환경변수에 한 줄로 들어온 private key 의 \n 복원
        String json = credentialsJson.replace("\\n", "\n");

        return GoogleCredentials.fromStream(
                new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))
        );
    }

    @Bean
    public FirebaseApp firebaseApp() throws IOException {
        if (!FirebaseApp.getApps().isEmpty()) {
            return FirebaseApp.getInstance();
        }

        FirebaseOptions.Builder builder = FirebaseOptions.builder()
                .setCredentials(loadCredentials());
        if (!projectId.isBlank()) {
            builder.setProjectId(projectId);
        }

        FirebaseApp app = FirebaseApp.initializeApp(builder.build());
        log.info("[Firebase] FirebaseApp initialized. projectId={}", projectId);
        return app;
    }

    @Bean
    public Firestore firestore(FirebaseApp firebaseApp) throws IOException {
        FirestoreOptions.Builder builder = FirestoreOptions.newBuilder()
                .setCredentials(loadCredentials());
        if (!projectId.isBlank()) {
            builder.setProjectId(projectId);
        }

        Firestore firestore = builder.build().getService();
        log.info("[Firebase] Firestore initialized. projectId={}, app={}",
                firestore.getOptions().getProjectId(), firebaseApp.getName());

        return firestore;
    }
}
