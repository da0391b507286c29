package ae.teletronics.uploadguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UploadGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(UploadGuardApplication.class, args);
    }
}
