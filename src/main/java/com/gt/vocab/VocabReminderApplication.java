package com.gt.vocab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.ApplicationPidFileWriter;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.annotation.EnableScheduling;

// The data source is built by PGBeanConfig, and only when the postgres store is selected
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableScheduling
@ComponentScan("com.gt.vocab")
public class VocabReminderApplication {

	public static void main(String[] args) {
		SpringApplication springApplication = new SpringApplication(VocabReminderApplication.class);
		springApplication.addListeners(new ApplicationPidFileWriter());
		springApplication.run(args);
	}

}
