package tech.andrefsramos.cptools;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CptoolsApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CptoolsApplication.class, args)));
    }
}
