package dao.tron.rdist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RewardDistributorApplication {

    public static void main(String[] args) {
        SpringApplication.run(RewardDistributorApplication.class, args);
    }
}
