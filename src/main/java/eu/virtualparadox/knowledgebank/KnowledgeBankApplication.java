package eu.virtualparadox.knowledgebank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KnowledgeBankApplication {

    public static void main(final String[] args) {
        SpringApplication.run(KnowledgeBankApplication.class, args);
    }
}
