package com.cafepos.customer.service;

import com.cafepos.common.exception.BusinessException;
import com.cafepos.common.exception.ErrorCode;
import com.cafepos.common.security.Principal;
import com.cafepos.common.security.Role;
import com.cafepos.customer.dto.CustomerResponse;
import com.cafepos.customer.dto.LoyaltyStatus;
import com.cafepos.customer.entity.Customer;
import com.cafepos.customer.repository.CustomerRepository;
import com.cafepos.settings.service.SettingsReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CustomerService {

    static final String DEFAULT_FIRST_NAME = "Guest";

    private final CustomerRepository customerRepository;
    private final LoyaltyCalculator loyaltyCalculator;
    private final SettingsReader settingsReader;

    /**
     * Returns the customer for this phone (checked first) or email, locked for update,
     * creating one when neither matches.
     *
     * <p>The insert is flushed immediately. If a concurrent transaction created the same
     * phone or email first, the unique constraint fails here with a
     * {@code DataIntegrityViolationException} and the caller's transaction is retried,
     * at which point the lookup finds the committed row.</p>
     */
    @Transactional
    public Customer findOrCreate(String customerName, String phone, String email) {
        String normalizedPhone = normalizePhone(phone);
        String normalizedEmail = normalizeEmail(email);
        if (normalizedPhone == null && normalizedEmail == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer phone or email is required");
        }

        Optional<Customer> existing = Optional.empty();
        if (normalizedPhone != null) {
            existing = customerRepository.findByPhoneWithLock(normalizedPhone);
        }
        if (existing.isEmpty() && normalizedEmail != null) {
            existing = customerRepository.findByEmailWithLock(normalizedEmail);
        }
        if (existing.isPresent()) {
            Customer customer = existing.get();
            if (!customer.isActive()) {
                throw new BusinessException(ErrorCode.CUSTOMER_NOT_FOUND, "Customer is deactivated: " + customer.getId());
            }
            return customer;
        }

        String[] name = splitName(customerName);
        Customer customer = customerRepository.saveAndFlush(Customer.builder()
                .phone(normalizedPhone)
                .email(normalizedEmail)
                .firstName(name[0])
                .lastName(name[1])
                .build());
        log.info("Customer created: id={}, phone={}", customer.getId(), normalizedPhone);
        return customer;
    }

    @Transactional
    public Customer getCustomerForUpdate(Long customerId) {
        return customerRepository.findByIdWithLock(customerId)
                .filter(Customer::isActive)
                .orElseThrow(() -> new BusinessException(ErrorCode.CUSTOMER_NOT_FOUND,
                        "Customer not found: " + customerId));
    }

    /**
     * Reverses a cancelled order's effect on the customer's aggregates, using the point values
     * stored on the order rather than the current loyalty ratio.
     */
    @Transactional
    public Customer reverseOrder(Long customerId, BigDecimal orderTotal, int pointsEarned, int pointsRedeemed) {
        Customer customer = customerRepository.findByIdWithLock(customerId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CUSTOMER_NOT_FOUND,
                        "Customer not found: " + customerId));
        customer.reverseOrder(orderTotal, pointsEarned, pointsRedeemed);
        log.info("Customer aggregates reversed: id={}, total={}, pointsEarned={}, pointsRestored={}",
                customerId, orderTotal, pointsEarned, pointsRedeemed);
        return customer;
    }

    public CustomerResponse getCustomer(Long customerId, Principal principal) {
        Principal.require(principal).requireAnyRole(Role.MANAGER, Role.ADMIN);
        Customer customer = customerRepository.findById(customerId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CUSTOMER_NOT_FOUND));
        return toResponse(customer);
    }

    public CustomerResponse getCustomerByPhone(String phone, Principal principal) {
        Principal.require(principal).requireAnyRole(Role.MANAGER, Role.ADMIN);
        String normalizedPhone = normalizePhone(phone);
        if (normalizedPhone == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Phone is required");
        }
        Customer customer = customerRepository.findByPhone(normalizedPhone)
                .orElseThrow(() -> new BusinessException(ErrorCode.CUSTOMER_NOT_FOUND));
        return toResponse(customer);
    }

    public LoyaltyStatus loyaltyStatus(Customer customer) {
        return loyaltyCalculator.evaluate(customer.getTotalOrders(), customer.getTotalSpent(),
                settingsReader.getTierThresholds(), settingsReader.getVipThreshold());
    }

    private CustomerResponse toResponse(Customer customer) {
        return CustomerResponse.of(customer, loyaltyStatus(customer));
    }

    static String[] splitName(String customerName) {
        if (!StringUtils.hasText(customerName)) {
            return new String[]{DEFAULT_FIRST_NAME, null};
        }
        String[] parts = customerName.trim().split("\\s+", 2);
        return new String[]{parts[0], parts.length > 1 ? parts[1] : null};
    }

    static String normalizePhone(String phone) {
        return StringUtils.hasText(phone) ? phone.trim() : null;
    }

    static String normalizeEmail(String email) {
        return StringUtils.hasText(email) ? email.trim().toLowerCase(Locale.ROOT) : null;
    }
}
