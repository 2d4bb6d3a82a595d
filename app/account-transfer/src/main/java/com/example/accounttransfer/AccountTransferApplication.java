package com.example.accounttransfer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication
@RestController
public class AccountTransferApplication {

  public static void main(String[] args) {
    SpringApplication.run(AccountTransferApplication.class, args);
  }

  @GetMapping("/")
  public String home() {
    return "account-transfer: ok";
  }
}
