package com.whisk.shopkeeper.config;

import com.whisk.shopkeeper.model.*;
import com.whisk.shopkeeper.repository.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.math.BigDecimal;

@Configuration
@Slf4j
public class DataInitializer {

    public static final String ADMIN_USERNAME = "admin@whiskandwhisk.com";

    @Bean
    CommandLineRunner init(ShopProperties properties,
            UserRepository userRepo,
            CustomerRepository customerRepo,
            StockItemRepository stockRepo,
            PasswordEncoder encoder) {
        return args -> {
            if (!properties.getSeed().isEnabled()) {
                return;
            }
            // Only a brand new database gets the sample data
            if (userRepo.count() > 0) {
                return;
            }

            AppUser admin = new AppUser();
            admin.setUsername(ADMIN_USERNAME);
            admin.setPassword(encoder.encode("password"));
            admin.setRole(UserRole.ADMIN);
            admin.setFullName("Shop Admin");
            userRepo.save(admin);

            customerRepo.save(customer("Arun Kumar", "arun@example.com", "9876543210",
                    "123 Anna Nagar, Chennai", "1990-08-15", "2015-11-20"));
            customerRepo.save(customer("Priya Sharma", "priya@example.com", "9123456780",
                    "456 T Nagar, Chennai", "1992-04-22", ""));

            stockRepo.save(stock("Flour", StockItem.CATEGORY_INGREDIENT, "50", "kg", "40", "10", null));
            stockRepo.save(stock("Sugar", StockItem.CATEGORY_INGREDIENT, "40", "kg", "55", "5", null));
            stockRepo.save(stock("Butter", StockItem.CATEGORY_INGREDIENT, "20", "kg", "500", "4", null));
            stockRepo.save(stock("Croissant", StockItem.CATEGORY_FINISHED_PRODUCT, "50", "pcs", "25", "10", "75"));
            stockRepo.save(stock("Chocolate Cake (1kg)", StockItem.CATEGORY_FINISHED_PRODUCT, "10", "pcs", "400", "3",
                    "850"));
            stockRepo.save(stock("Cake Box (1kg)", StockItem.CATEGORY_PACKAGING, "100", "pcs", "15", "20", null));

            log.info("Seeded admin user, {} customers and {} stock items", customerRepo.count(), stockRepo.count());
        };
    }

    private static Customer customer(String name, String email, String phone, String address, String birthday,
            String anniversary) {
        Customer c = new Customer();
        c.setName(name);
        c.setEmail(email);
        c.setPhone(phone);
        c.setAddress(address);
        c.setBirthday(birthday);
        c.setAnniversary(anniversary);
        return c;
    }

    private static StockItem stock(String name, String category, String quantity, String unit, String cost,
            String threshold, String sellingPrice) {
        StockItem item = new StockItem();
        item.setName(name);
        item.setCategory(category);
        item.setQuantity(new BigDecimal(quantity));
        item.setUnit(unit);
        item.setCostPerUnit(new BigDecimal(cost));
        item.setLowStockThreshold(new BigDecimal(threshold));
        if (sellingPrice != null) {
            item.setSellingPrice(new BigDecimal(sellingPrice));
        }
        return item;
    }
}
