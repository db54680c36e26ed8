package com.chommie.jobsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobSearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(JobSearchApplication.class, args);
  }
}
