package eu.virtualparadox.docclassifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocClassifierApplication {

    public static void main(final String[] args) {
        SpringApplication.run(DocClassifierApplication.class, args);
    }
}
