package uk.gegc.billingrecon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BillingReconcilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BillingReconcilerApplication.class, args);
    }
}
