package app.lexrecall.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LexRecallCoreApplication {

	public static void main(String[] args) {
		SpringApplication.run(LexRecallCoreApplication.class, args);
	}

}
