package com.cafepos.customer.controller;

import com.cafepos.common.dto.ApiResponse;
import com.cafepos.common.security.CurrentPrincipal;
import com.cafepos.common.security.Principal;
import com.cafepos.customer.dto.CustomerResponse;
import com.cafepos.customer.service.CustomerService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/customers")
@RequiredArgsConstructor
public class CustomerController {

    private final CustomerService customerService;

    @GetMapping("/{id}")
    public ApiResponse<CustomerResponse> getCustomer(@PathVariable Long id,
                                                     @CurrentPrincipal Principal principal) {
        return ApiResponse.ok(customerService.getCustomer(id, principal));
    }

    @GetMapping("/lookup")
    public ApiResponse<CustomerResponse> lookupByPhone(@RequestParam String phone,
                                                       @CurrentPrincipal Principal principal) {
        return ApiResponse.ok(customerService.getCustomerByPhone(phone, principal));
    }
}
